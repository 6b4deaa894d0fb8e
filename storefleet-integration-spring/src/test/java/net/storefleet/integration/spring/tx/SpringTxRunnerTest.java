package net.storefleet.integration.spring.tx;

import net.storefleet.adapter.jdbc.TxContext;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.*;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;

import java.io.IOException;
import java.sql.Connection;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
@TestMethodOrder(MethodOrderer.MethodName.class)
class SpringTxRunnerTest {

    JdbcDataSource ds;
    SpringTxRunner tx;

    @BeforeAll
    void initAll() throws Exception {
        ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:spring_tx;DB_CLOSE_DELAY=-1");
        ds.setUser("sa");
        try (Connection c = ds.getConnection(); var st = c.createStatement()) {
            st.execute("CREATE TABLE T_NOTE (ID INT PRIMARY KEY, BODY VARCHAR(50))");
        }
        tx = new SpringTxRunner(new DataSourceTransactionManager(ds), ds);
    }

    @BeforeEach
    void truncate() throws Exception {
        try (Connection c = ds.getConnection(); var st = c.createStatement()) {
            st.execute("DELETE FROM T_NOTE");
        }
    }

    private void insert(int id) throws Exception {
        try (var ps = TxContext.require().prepareStatement("INSERT INTO T_NOTE (ID, BODY) VALUES (?, 'x')")) {
            ps.setInt(1, id);
            ps.executeUpdate();
        }
    }

    private int count() throws Exception {
        return tx.required(() -> {
            try (var rs = TxContext.require().createStatement().executeQuery("SELECT COUNT(*) FROM T_NOTE")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }

    @Test
    void a1_commit_andContextCleared() throws Exception {
        tx.required(() -> insert(1));
        assertEquals(1, count());
        assertNull(TxContext.get());
    }

    @Test
    void a2_checkedException_rollsBack_andPropagatesUnchanged() throws Exception {
        IOException boom = new IOException("disk");
        IOException thrown = assertThrows(IOException.class, () -> tx.required(() -> {
            insert(2);
            throw boom;
        }));
        assertSame(boom, thrown);
        assertEquals(0, count());
        assertNull(TxContext.get());
    }

    @Test
    void a3_requiresNew_survivesOuterRollback_andRestoresOuterConnection() throws Exception {
        assertThrows(IllegalStateException.class, () -> tx.required(() -> {
            Connection outer = TxContext.require();
            insert(3);
            tx.requiresNew(() -> insert(4));
            assertSame(outer, TxContext.get());
            throw new IllegalStateException("undo outer");
        }));
        assertEquals(1, count());
    }

    @Test
    void a4_nestedRequired_sharesConnection() throws Exception {
        tx.required(() -> {
            Connection outer = TxContext.require();
            tx.required(() -> assertSame(outer, TxContext.require()));
            insert(5);
        });
        assertEquals(1, count());
    }
}
