package party.iroiro.r2oracle;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.r2dbc.core.binding.BindMarkersFactory;
import party.iroiro.r2oracle.util.PlaceholderTranslator;
import party.iroiro.r2oracle.util.QueueDispatcher;
import party.iroiro.r2oracle.value.Value;
import reactor.test.StepVerifier;

import java.lang.reflect.Field;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class OracleConnectionTest {
    private QueueDispatcher<OraclePacket> dispatcher;
    private Thread dispatching;
    private Connection jdbc;
    private PreparedStatement statement;
    private OracleConnection connection;

    @BeforeEach
    public void setUp() throws NoSuchFieldException, IllegalAccessException, SQLException {
        dispatcher = new QueueDispatcher<>();
        dispatching = new Thread(dispatcher);
        dispatching.start();

        jdbc = mock(Connection.class);
        statement = mock(PreparedStatement.class);
        when(statement.getUpdateCount()).thenReturn(1);
        when(jdbc.prepareStatement(anyString())).thenReturn(statement);

        OracleWorker worker = new OracleWorker(
                new LinkedBlockingDeque<>(OracleWorker.QUEUE_CAPACITY),
                dispatcher.subQueue(),
                new OracleConnectOptions("", "", "")
        );
        Field field = OracleWorker.class.getDeclaredField("conn");
        field.setAccessible(true);
        field.set(worker, jdbc);
        new Thread(worker).start();

        connection = new OracleConnection(worker, new TransactionFlag(),
                new PlaceholderTranslator('?', BindMarkersFactory.indexed(":", 1)));
    }

    @AfterEach
    public void tearDown() throws InterruptedException {
        connection.close().block();
        dispatching.interrupt();
        dispatching.join();
    }

    @Test
    public void autocommitByDefault() throws SQLException {
        assertFalse(connection.isInTransaction());
        StepVerifier.create(connection.exec("insert into t values (?, ?)", List.of(Value.of(1), Value.of("a"))))
                .expectNext(new ExecResult(1, Value.NULL))
                .verifyComplete();
        InOrder order = inOrder(jdbc, statement);
        order.verify(jdbc).prepareStatement("insert into t values (:1, :2)");
        order.verify(statement).setInt(1, 1);
        order.verify(statement).setString(2, "a");
        order.verify(statement).execute();
        order.verify(jdbc).commit();
        assertFalse(connection.isInTransaction());
    }

    @Test
    public void explicitTransaction() throws SQLException {
        StepVerifier.create(connection.exec("begin")).expectNext(ExecResult.NONE).verifyComplete();
        assertTrue(connection.isInTransaction());
        verifyNoInteractions(jdbc);

        StepVerifier.create(connection.exec("insert into t values (1)")).expectNextCount(1).verifyComplete();
        StepVerifier.create(connection.exec("insert into t values (2)")).expectNextCount(1).verifyComplete();
        verify(jdbc, never()).commit();
        assertTrue(connection.isInTransaction());

        StepVerifier.create(connection.exec("commit")).expectNext(ExecResult.NONE).verifyComplete();
        verify(jdbc, times(1)).commit();
        assertFalse(connection.isInTransaction());
        verify(jdbc, never()).prepareStatement("commit");
    }

    @Test
    public void rollbackEndsTransaction() throws SQLException {
        connection.exec("begin").block();
        connection.exec("delete from t").block();
        StepVerifier.create(connection.exec("rollback")).expectNext(ExecResult.NONE).verifyComplete();
        verify(jdbc).rollback();
        verify(jdbc, never()).commit();
        assertFalse(connection.isInTransaction());

        connection.exec("delete from t").block();
        verify(jdbc).commit();
    }

    @Test
    public void failedCommitKeepsTransaction() throws SQLException {
        doThrow(new SQLException("ORA-02091")).when(jdbc).commit();
        connection.exec("begin").block();
        StepVerifier.create(connection.exec("commit")).expectError(StatementException.class).verify();
        assertTrue(connection.isInTransaction());
    }

    @Test
    public void reservedWordsAreCaseSensitive() throws SQLException {
        connection.exec("BEGIN").block();
        assertFalse(connection.isInTransaction());
        verify(jdbc).prepareStatement("BEGIN");
        verify(jdbc).commit();
    }

    @Test
    public void failedStatementLeavesStateAlone() throws SQLException {
        when(statement.execute()).thenThrow(new SQLException("ORA-00942"));
        StepVerifier.create(connection.exec("insert into missing values (1)"))
                .expectError(StatementException.class)
                .verify();
        verify(jdbc, never()).commit();
        assertFalse(connection.isInTransaction());
    }

    @Test
    public void queriesNeverCommit() throws SQLException {
        when(statement.executeQuery()).thenThrow(new SQLException("ORA-00942"));
        StepVerifier.create(connection.getRows("select * from t where a = ?", List.of(Value.of(1))))
                .expectError(StatementException.class)
                .verify();
        verify(jdbc).prepareStatement("select * from t where a = :1");
        verify(jdbc, never()).commit();
    }

    @Test
    public void ping() throws SQLException {
        when(jdbc.isValid(0)).thenReturn(true, false);
        StepVerifier.create(connection.ping()).verifyComplete();
        StepVerifier.create(connection.ping()).expectError(ConnectionException.class).verify();
    }

    @Test
    public void duplicatesShareState() throws SQLException {
        OracleConnection duplicate = connection.duplicate();
        duplicate.exec("begin").block();
        assertTrue(connection.isInTransaction());

        StepVerifier.create(duplicate.close()).verifyComplete();
        assertTrue(duplicate.isClosed());
        verify(jdbc, never()).close();
        StepVerifier.create(duplicate.exec("commit")).expectError(ConnectionException.class).verify();

        StepVerifier.create(connection.exec("commit")).expectNextCount(1).verifyComplete();
        assertFalse(connection.isInTransaction());
    }

    @Test
    public void closedConnection() throws SQLException {
        connection.exec("begin").block();
        StepVerifier.create(connection.close()).verifyComplete();
        verify(jdbc).commit();
        verify(jdbc).close();
        StepVerifier.create(connection.close()).verifyComplete();

        StepVerifier.create(connection.exec("select 1 from dual")).expectErrorMessage("Connection closed").verify();
        StepVerifier.create(connection.getRows("select 1 from dual")).expectError(ConnectionException.class).verify();
        StepVerifier.create(connection.ping()).expectError(ConnectionException.class).verify();
        assertThrows(ConnectionException.class, connection::duplicate);
    }
}
