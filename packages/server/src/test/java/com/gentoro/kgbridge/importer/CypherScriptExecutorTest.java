package com.gentoro.kgbridge.importer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.gentoro.kgbridge.store.GraphSession;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CypherScriptExecutorTest {

  @Mock GraphSession session;

  @Test
  void failingStatementDoesNotStopTheScript() {
    lenient()
        .doThrow(new IllegalStateException("Invalid input 'CRATE'"))
        .when(session)
        .execute("CRATE (b:B)");
    RecordingImportListener listener = new RecordingImportListener();

    ImportOutcome outcome =
        new CypherScriptExecutor()
            .execute("CREATE (a:A);\nCRATE (b:B);\nCREATE (c:C);", session, listener);

    InOrder order = inOrder(session);
    order.verify(session).execute("CREATE (a:A)");
    order.verify(session).execute("CRATE (b:B)");
    order.verify(session).execute("CREATE (c:C)");
    assertEquals(3, outcome.getStatementsAttempted());
    assertEquals(2, outcome.getStatementsExecuted());

    EntityFailure failure = outcome.failures().get(0);
    assertEquals(EntityFailure.Kind.STATEMENT, failure.kind());
    assertEquals("#2", failure.identifier());
    assertEquals("CRATE (b:B)", failure.type());
    assertEquals("Invalid input 'CRATE'", failure.reason());
    assertEquals("end statements 2/3", listener.events.get(listener.events.size() - 1));
  }
}
