/**
 * Spring Boot auto-configuration: {@link dualstore.spring.boot.DualStoreProperties} binds the
 * {@code dualstore.*} properties and {@link dualstore.spring.boot.DualStoreAutoConfiguration}
 * builds and starts the manager.
 */
package dualstore.spring.boot;
