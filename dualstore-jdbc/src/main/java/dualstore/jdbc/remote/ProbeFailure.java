package dualstore.jdbc.remote;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Why a health probe failed. Used for log lines only; every kind means "unhealthy".
 */
public enum ProbeFailure {
  CONNECTION_REFUSED,
  TIMEOUT,
  HOST_UNRESOLVED,
  OTHER;

  /**
   * Walks the cause chain looking for a recognizable network or JDBC failure.
   */
  public static ProbeFailure classify(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof UnknownHostException) {
        return HOST_UNRESOLVED;
      }
      if (t instanceof ConnectException) {
        return CONNECTION_REFUSED;
      }
      if (t instanceof SocketTimeoutException
          || t instanceof SQLTimeoutException
          || t instanceof TimeoutException) {
        return TIMEOUT;
      }
      // SQLState class 08: connection exception
      if (t instanceof SQLException sql && sql.getSQLState() != null
          && sql.getSQLState().startsWith("08") && t.getCause() == null) {
        return CONNECTION_REFUSED;
      }
    }
    return OTHER;
  }
}
