package com.example.peak.parser;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import com.example.peak.model.ExtractOptions;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;

class TikTokRowExtractorTest {

    static final String INVOICE = String.join("\n",
            "TikTok Shop (Thailand) Ltd.",
            "Tax Registration Number: 0105566214176",
            "Head Office",
            "Tax Invoice / Receipt",
            "Invoice No: TTSTH20250008665805",
            "Invoice date: Dec 3, 2025",
            "Bill to: RABBIT CO., LTD. Tax ID 0105561071873",
            "Subtotal (excluding VAT): 147,162.62",
            "Total VAT 7%: 10,301.38",
            "Total amount (including VAT): 157,464.00",
            "The buyer has withheld tax at the rate of 3% amounting to ฿4,414.88");

    private final TikTokRowExtractor extractor = new TikTokRowExtractor();

    private PeakRow extract(String text, String clientTaxId) {
        return extractor.extract(new ExtractRequest(text, "tt.pdf", clientTaxId, ExtractOptions.defaults(), Platform.TIKTOK));
    }

    @Test
    void extractsInvoiceFields() {
        PeakRow row = extract(INVOICE, "0105561071873");

        assertThat(row.get(PeakColumn.G_INVOICE_NO)).isEqualTo("TTSTH20250008665805");
        assertThat(row.get(PeakColumn.C_REFERENCE)).isEqualTo("TTSTH20250008665805");
        assertThat(row.get(PeakColumn.E_TAX_ID_13)).isEqualTo("0105566214176");
        assertThat(row.get(PeakColumn.F_BRANCH_5)).isEqualTo("00000");
        assertThat(row.get(PeakColumn.B_DOC_DATE)).isEqualTo("20251203");
        assertThat(row.get(PeakColumn.H_INVOICE_DATE)).isEqualTo("20251203");
        assertThat(row.get(PeakColumn.I_TAX_PURCHASE_DATE)).isEqualTo("20251203");
        assertThat(row.get(PeakColumn.D_VENDOR_CODE)).isEqualTo("Unknown");
    }

    @Test
    void grossGoesToPaidAndUnitPrice() {
        PeakRow row = extract(INVOICE, "");

        assertThat(row.get(PeakColumn.R_PAID_AMOUNT)).isEqualTo("157464.00");
        assertThat(row.get(PeakColumn.N_UNIT_PRICE)).isEqualTo("157464.00");
        assertThat(row.hint("subtotal_ex_vat")).isEqualTo("147162.62");
        assertThat(row.hint("vat_amount")).isEqualTo("10301.38");
        assertThat(row.get(PeakColumn.P_WHT)).isEqualTo("4414.88");
        assertThat(row.get(PeakColumn.U_GROUP)).isEqualTo("Marketplace Expense");
    }

    @Test
    void totalIsDerivedFromSubtotalAndVat() {
        String text = "TikTok Shop\nSubtotal (excluding VAT): 100.00\nTotal VAT 7%: 7.00";

        PeakRow row = extract(text, "");

        assertThat(row.get(PeakColumn.R_PAID_AMOUNT)).isEqualTo("107.00");
    }

    @Test
    void vendorTaxSkipsClientTaxId() {
        String text = "TikTok Shop\nBill to 0105561071873\nSeller 0105566214176\nInvoice date: 2025-11-30";

        PeakRow row = extract(text, "0105561071873");

        assertThat(row.get(PeakColumn.E_TAX_ID_13)).isEqualTo("0105566214176");
        assertThat(row.get(PeakColumn.B_DOC_DATE)).isEqualTo("20251130");
    }

    @Test
    void adsInvoiceGetsAdvertisingGroup() {
        PeakRow row = extract("TikTok Ads invoice\nInvoice No: TTSTH20250000000001", "");

        assertThat(row.get(PeakColumn.U_GROUP)).isEqualTo("Advertising Expense");
    }

    @Test
    void emptyTextGivesDefaultsOnly() {
        PeakRow row = extract("  ", "");

        assertThat(row.get(PeakColumn.G_INVOICE_NO)).isEmpty();
        assertThat(row.get(PeakColumn.R_PAID_AMOUNT)).isEqualTo("0.00");
        assertThat(row.get(PeakColumn.N_UNIT_PRICE)).isEqualTo("0.00");
        assertThat(row.get(PeakColumn.O_VAT_RATE)).isEqualTo("7%");
    }

    @Test
    void fullMonthNameInInvoiceDateLine() {
        PeakRow row = extract("TikTok Shop\nInvoice date: December 3, 2025", "");

        assertThat(row.get(PeakColumn.B_DOC_DATE)).isEqualTo("20251203");
    }

    @Test
    void impossibleInvoiceDateFallsBackToFirstDateInText() {
        String text = "TikTok Shop\nPrinted 2025-11-30\nInvoice date: 2025-02-30";

        PeakRow row = extract(text, "");

        assertThat(row.get(PeakColumn.H_INVOICE_DATE)).isEqualTo("20251130");
    }
}
