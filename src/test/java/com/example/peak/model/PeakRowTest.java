package com.example.peak.model;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class PeakRowTest {

    @Test
    void fromMapSplitsColumnsHintsAndDiagnostics() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("B_doc_date", "20251203");
        raw.put("P_wht", null);
        raw.put("seller_id", 253227155);
        raw.put("_platform", "SHOPEE");

        PeakRow row = PeakRow.fromMap(raw);

        assertThat(row.get(PeakColumn.B_DOC_DATE)).isEqualTo("20251203");
        assertThat(row.isSet(PeakColumn.P_WHT)).isTrue();
        assertThat(row.isBlank(PeakColumn.P_WHT)).isTrue();
        assertThat(row.isSet(PeakColumn.Q_PAYMENT_METHOD)).isFalse();
        assertThat(row.hint("sellerId", "seller_id")).isEqualTo("253227155");
        assertThat(row.diagnosticText("_platform")).isEqualTo("SHOPEE");
    }

    @Test
    void setIfBlankKeepsExistingValue() {
        PeakRow row = new PeakRow().set(PeakColumn.M_QTY, "2");

        row.setIfBlank(PeakColumn.M_QTY, "1");
        row.setIfBlank(PeakColumn.O_VAT_RATE, "7%");

        assertThat(row.get(PeakColumn.M_QTY)).isEqualTo("2");
        assertThat(row.get(PeakColumn.O_VAT_RATE)).isEqualTo("7%");
    }

    @Test
    void lockedMapDropsHintsAndKeepsPrefixedDiagnostics() {
        PeakRow row = new PeakRow();
        row.putHint("shop_name", "x");
        row.putDiagnostic("wallet_code_resolved", "EWL001");

        Map<String, Object> out = row.toLockedMap();

        assertThat(out).hasSize(PeakColumn.values().length + 1);
        assertThat(out).containsEntry("_wallet_code_resolved", "EWL001");
        assertThat(out).doesNotContainKey("shop_name");
    }

    @Test
    void appendDiagnosticBoundsMessages() {
        PeakRow row = new PeakRow();
        row.appendDiagnostic("_ai_errors", "x".repeat(800));
        row.appendDiagnostic("_ai_errors", "second");

        List<?> errors = (List<?>) row.diagnostic("_ai_errors");
        assertThat(errors).hasSize(2);
        assertThat((String) errors.get(0)).hasSize(PeakRow.MAX_DIAGNOSTIC_LENGTH);
    }

    @Test
    void copyIsIndependent() {
        PeakRow row = new PeakRow().set(PeakColumn.C_REFERENCE, "A");
        row.appendDiagnostic("_ai_errors", "one");

        PeakRow copy = row.copy();
        copy.set(PeakColumn.C_REFERENCE, "B");
        copy.appendDiagnostic("_ai_errors", "two");

        assertThat(row.get(PeakColumn.C_REFERENCE)).isEqualTo("A");
        assertThat((List<?>) row.diagnostic("_ai_errors")).hasSize(1);
    }
}
