package com.integration.migrator.util;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for NamingUtil and FileWriteUtil naming.
 */
class NamingUtilTest {

    @Test
    void testSafeActionName() {
        assertThat(NamingUtil.safeActionName("Send Order")).isEqualTo("Send_Order");
        assertThat(NamingUtil.safeActionName("Case_\"EU\"")).isEqualTo("Case_EU");
        assertThat(NamingUtil.safeActionName("retry-loop")).isEqualTo("retry-loop");
        assertThat(NamingUtil.safeActionName("1st.Step")).isEqualTo("Action_1stStep");
        assertThat(NamingUtil.safeActionName("$#!")).isEqualTo("Unnamed");
        assertThat(NamingUtil.safeActionName(null)).isEqualTo("Unnamed");
    }

    @Test
    void testLastSegment() {
        assertThat(NamingUtil.lastSegment("Contoso.Maps.Invoice_To_EU")).isEqualTo("Invoice_To_EU");
        assertThat(NamingUtil.lastSegment("Plain")).isEqualTo("Plain");
        assertThat(NamingUtil.lastSegment(null)).isNull();
    }

    @Test
    void testSafeFileName() {
        assertThat(FileWriteUtil.safeFileName("Ns.Flow")).isEqualTo("Ns.Flow");
        assertThat(FileWriteUtil.safeFileName("a/b c")).isEqualTo("a_b_c");
        assertThat(FileWriteUtil.safeFileName("")).isEqualTo("workflow");
    }
}
