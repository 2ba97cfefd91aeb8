/**
 * Small shared utilities: thread factory, payload JSON codec, deadline-bounded calls.
 */
package dualstore.util;
