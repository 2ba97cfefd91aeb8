package dualstore.jdbc.remote;

import org.junit.jupiter.api.Test;

import java.net.ConnectException;
import java.net.UnknownHostException;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ProbeFailureTest {

  @Test
  void classifiesThroughCauseChain() {
    assertEquals(ProbeFailure.CONNECTION_REFUSED, ProbeFailure.classify(
        new SQLException("io", "08001", new ConnectException("Connection refused"))));
    assertEquals(ProbeFailure.HOST_UNRESOLVED, ProbeFailure.classify(
        new SQLException("io", new UnknownHostException("db.invalid"))));
    assertEquals(ProbeFailure.TIMEOUT, ProbeFailure.classify(new TimeoutException()));
    assertEquals(ProbeFailure.TIMEOUT, ProbeFailure.classify(new SQLTimeoutException("slow")));
  }

  @Test
  void connectionStateWithoutCauseCountsAsRefused() {
    assertEquals(ProbeFailure.CONNECTION_REFUSED,
        ProbeFailure.classify(new SQLException("gone", "08006")));
  }

  @Test
  void anythingElseIsOther() {
    assertEquals(ProbeFailure.OTHER, ProbeFailure.classify(new SQLException("syntax", "42000")));
    assertEquals(ProbeFailure.OTHER, ProbeFailure.classify(new IllegalStateException()));
    assertEquals(ProbeFailure.OTHER, ProbeFailure.classify(null));
  }
}
