package io.github.yok.temporalsync.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import io.github.yok.temporalsync.sink.SqlDialect;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConnectionConfigTest {

    private static ConnectionConfig.Entry entry(String id, String url) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(id);
        entry.setUrl(url);
        return entry;
    }

    @Test
    void find_正常ケース_登録済みのID_該当する接続が返ること() {
        ConnectionConfig config = new ConnectionConfig();
        config.setConnections(List.of(entry("dw", "jdbc:postgresql://db/dw"),
                entry("erp", "jdbc:oracle:thin:@erp:1521/ERP")));

        assertEquals("jdbc:oracle:thin:@erp:1521/ERP", config.find("erp").get().getUrl());
        assertFalse(config.find("other").isPresent());
        assertFalse(config.find(null).isPresent());
    }

    @Test
    void find_正常ケース_接続が未設定_空が返ること() {
        assertFalse(new ConnectionConfig().find("dw").isPresent());
    }

    @Test
    void resolveDialect_正常ケース_方言指定ありとなし_指定またはURLから決まること() {
        ConnectionConfig.Entry derived = entry("dw", "jdbc:postgresql://db/dw");
        assertEquals(SqlDialect.POSTGRESQL, derived.resolveDialect());

        ConnectionConfig.Entry explicit = entry("dw", "jdbc:postgresql://db/dw");
        explicit.setDialect(SqlDialect.H2);
        assertEquals(SqlDialect.H2, explicit.resolveDialect());
    }

    @Test
    void resolveDialect_異常ケース_未対応のURLで方言なし_IllegalArgumentExceptionが送出されること() {
        assertThrows(IllegalArgumentException.class,
                () -> entry("x", "jdbc:db2://host/x").resolveDialect());
    }
}
