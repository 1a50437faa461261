package org.carball.qdsclean.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SqlIdentifiersTest {

    @Test
    void shouldQuoteLikeQuotename() {
        assertThat(SqlIdentifiers.quoteName("Orders")).isEqualTo("[Orders]");
        assertThat(SqlIdentifiers.quoteName("a]b")).isEqualTo("[a]]b]");
    }

    @Test
    void shouldQualifyWithSchema() {
        assertThat(SqlIdentifiers.qualifiedName("sales", "usp_GetOrders")).isEqualTo("[sales].[usp_GetOrders]");
    }
}
