package io.github.yok.temporalsync.sink;

import java.util.Locale;

/**
 * SQL differences between the supported databases that matter for versioned tables: identifier
 * quoting, the identity clause of the surrogate key and the physical type of each
 * {@link ColumnType}.
 *
 * @author Yasuharu.Okawauchi
 */
public enum SqlDialect {

    H2 {
        @Override
        String textType() {
            return "CHARACTER VARYING";
        }
    },

    POSTGRESQL,

    MYSQL {
        @Override
        public String quoteIdentifier(String identifier) {
            return "`" + identifier + "`";
        }

        @Override
        public String identityColumnType() {
            return "BIGINT AUTO_INCREMENT PRIMARY KEY";
        }

        @Override
        String floatType() {
            return "DOUBLE";
        }
    },

    SQLSERVER {
        @Override
        public String quoteIdentifier(String identifier) {
            return "[" + identifier + "]";
        }

        @Override
        public String identityColumnType() {
            return "BIGINT IDENTITY(1,1) PRIMARY KEY";
        }

        @Override
        String textType() {
            return "NVARCHAR(MAX)";
        }

        @Override
        String varcharType(int length) {
            return "NVARCHAR(" + length + ")";
        }

        @Override
        String floatType() {
            return "FLOAT";
        }
    },

    ORACLE {
        @Override
        public String identityColumnType() {
            return "NUMBER(19) GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
        }

        @Override
        String textType() {
            return "CLOB";
        }

        @Override
        String varcharType(int length) {
            return "VARCHAR2(" + length + " CHAR)";
        }

        @Override
        String integerType() {
            return "NUMBER(19)";
        }

        @Override
        String floatType() {
            return "BINARY_DOUBLE";
        }
    };

    /**
     * Quotes an identifier so it keeps its exact case.
     *
     * @param identifier table, column or index name
     * @return quoted identifier
     */
    public String quoteIdentifier(String identifier) {
        return "\"" + identifier + "\"";
    }

    /**
     * Returns the column type clause of the surrogate key, including the primary-key constraint.
     *
     * @return identity clause
     */
    public String identityColumnType() {
        return "BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY";
    }

    /**
     * Returns the physical type of a business column.
     *
     * @param column column definition
     * @return SQL type
     */
    public String sqlType(ColumnDefinition column) {
        switch (column.getType()) {
            case TEXT:
                return textType();
            case VARCHAR:
                return varcharType(column.getLength());
            case INTEGER:
                return integerType();
            case FLOAT:
                return floatType();
            case DATE:
                return "DATE";
            default:
                throw new IllegalArgumentException("Unsupported column type: " + column.getType());
        }
    }

    String textType() {
        return "TEXT";
    }

    String varcharType(int length) {
        return "VARCHAR(" + length + ")";
    }

    String integerType() {
        return "BIGINT";
    }

    String floatType() {
        return "DOUBLE PRECISION";
    }

    /**
     * Resolves the dialect from a JDBC URL.
     *
     * @param jdbcUrl JDBC URL, e.g. {@code jdbc:postgresql://localhost/db}
     * @return matching dialect
     * @throws IllegalArgumentException if the URL names an unsupported database
     */
    public static SqlDialect fromJdbcUrl(String jdbcUrl) {
        String url = jdbcUrl == null ? "" : jdbcUrl.toLowerCase(Locale.ROOT);
        if (url.startsWith("jdbc:h2:")) {
            return H2;
        }
        if (url.startsWith("jdbc:postgresql:")) {
            return POSTGRESQL;
        }
        if (url.startsWith("jdbc:mysql:") || url.startsWith("jdbc:mariadb:")) {
            return MYSQL;
        }
        if (url.startsWith("jdbc:sqlserver:")) {
            return SQLSERVER;
        }
        if (url.startsWith("jdbc:oracle:")) {
            return ORACLE;
        }
        throw new IllegalArgumentException("Cannot determine SQL dialect from URL: " + jdbcUrl);
    }
}
