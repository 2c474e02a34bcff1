package party.iroiro.r2oracle;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import party.iroiro.r2oracle.value.ExtTag;
import party.iroiro.r2oracle.value.Value;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class H2RowTest extends IntegrationTestSupport {
    @BeforeEach
    public void createTable() {
        jdbc.execute("drop table if exists documents");
        jdbc.execute("create table documents (id number(10) primary key, title varchar2(40), "
                + "price number(12, 2), body clob, content blob)");
        jdbc.execute("insert into documents (id, title, price, body) values (1, 'first', 12.50, 'text')");
        jdbc.execute("insert into documents (id, title) values (2, 'second')");
    }

    @Test
    public void rowsShareMetadata() {
        List<OracleRow> rows = connection.getRows("select id as \"ID\", title, price, body from documents order by id")
                .block();
        assertNotNull(rows);
        assertEquals(2, rows.size());
        OracleMetaData metadata = rows.get(0).getMetadata();
        assertSame(metadata, rows.get(1).getMetadata());
        assertEquals(List.of("id", "title", "price", "body"), metadata.getColumnNames());
        assertEquals(1, metadata.getColumnIndex("TITLE"));
        assertThrows(NoSuchElementException.class, () -> metadata.getColumnIndex("missing"));

        OracleRow first = rows.get(0);
        assertEquals(Value.of(1L), first.get("id"));
        assertEquals(Value.of("first"), first.get("title"));
        assertEquals(Value.ext(ExtTag.DECIMAL, Value.of("12.50")), first.get("price"));
        assertEquals(Value.of("text"), first.get("body"));
        assertThrows(IndexOutOfBoundsException.class, () -> first.get(4));

        OracleRow second = rows.get(1);
        assertEquals(Value.NULL, second.get("price"));
        assertEquals(Value.NULL, second.get("body"));
        assertEquals(4, second.getValues().size());
    }

    @Test
    public void binaryRoundTrip() {
        byte[] bytes = new byte[256];
        for (int i = 0; i < bytes.length; i++) {
            bytes[i] = (byte) i;
        }
        StepVerifier.create(connection.exec("update documents set content = ? where id = 1",
                        List.of(Value.of(bytes))))
                .assertNext(result -> assertEquals(1, result.getRowsAffected()))
                .verifyComplete();

        List<OracleRow> rows = connection.getRows("select content from documents order by id").block();
        assertNotNull(rows);
        assertEquals(Value.of(bytes), rows.get(0).get(0));
        assertEquals(Value.NULL, rows.get(1).get(0));
    }

    @Test
    public void boundParameters() {
        connection.exec("insert into documents (id, title, price) values (?, ?, ?)",
                List.of(Value.of(3L), Value.of("third"), Value.ext(ExtTag.DECIMAL, Value.of("7.25")))).block();

        List<OracleRow> rows = connection.getRows("select title, price from documents where id = ?",
                List.of(Value.of(3))).block();
        assertNotNull(rows);
        assertEquals(1, rows.size());
        assertEquals(Value.of("third"), rows.get(0).get("title"));
        assertEquals(Value.ext(ExtTag.DECIMAL, Value.of("7.25")), rows.get(0).get("price"));
    }

    @Test
    public void temporalColumns() {
        List<OracleRow> rows = connection.getRows(
                "select date '2023-04-05' as d, timestamp '2023-04-05 06:07:08' as ts from dual").block();
        assertNotNull(rows);
        OracleRow row = rows.get(0);
        assertEquals(Value.ext(ExtTag.DATE_TIME, Value.of("2023-04-05T00:00:00")), row.get("d"));
        assertEquals(Value.ext(ExtTag.DATE_TIME, Value.of("2023-04-05T06:07:08")), row.get("ts"));
    }

    @Test
    public void emptyResult() {
        List<OracleRow> rows = connection.getRows("select * from documents where id < 0").block();
        assertNotNull(rows);
        assertTrue(rows.isEmpty());
    }
}
