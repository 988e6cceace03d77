package com.example.peak.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.example.peak.config.PipelineSettings;
import com.example.peak.model.ClientCompany;
import com.example.peak.model.ExtractOptions;
import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.model.Platform;

class RowFinalizerTest {

    private static final String RABBIT = ClientCompany.RABBIT.taxId();

    private PipelineSettings settings;
    private RowFinalizer finalizer;

    @BeforeEach
    void setUp() {
        settings = PipelineSettings.defaults();
        finalizer = new RowFinalizer(
                new ReferenceResolver(),
                new WalletResolver(new WalletMappingTables()),
                new WhtPolicyEngine(settings),
                new ClientIdentityResolver(settings),
                settings);
    }

    @Test
    void lockedRowHasExactly22ColumnsInOrderPlusDiagnostics() {
        PeakRow row = PeakRow.fromMap(Map.of(
                "B_doc_date", "20251203",
                "random_extra", "drop me",
                "_platform", "SHOPEE"));

        Map<String, Object> out = finalizer.finalizeRow(row, Platform.SHOPEE, "", "a.pdf", RABBIT, ExtractOptions.defaults());

        List<String> columnKeys = out.keySet().stream()
                .filter(k -> !k.startsWith("_"))
                .collect(Collectors.toList());
        List<String> expected = Arrays.stream(PeakColumn.values()).map(PeakColumn::key).collect(Collectors.toList());

        assertThat(columnKeys).containsExactlyElementsOf(expected);
        assertThat(out).doesNotContainKey("random_extra");
        assertThat(out).containsEntry("_platform", "SHOPEE");
        assertThat(out.values()).doesNotContainNull();
    }

    @Test
    void documentDateComesFromTextNeverFilename() {
        PeakRow row = new PeakRow();

        Map<String, Object> out = finalizer.finalizeRow(row, Platform.UNKNOWN, "no date here",
                "Shopee-TIV-TRSPEMKP00-00000-251203-0012589.pdf", "", ExtractOptions.defaults());

        assertThat(out.get("B_doc_date")).isEqualTo("");
    }

    @Test
    void documentDatePrefersLabeledDate() {
        Map<String, Object> out = finalizer.finalizeRow(new PeakRow(), Platform.UNKNOWN,
                "Printed 2025-01-05\nInvoice Date: 2025-12-03", "", "", ExtractOptions.defaults());

        assertThat(out.get("B_doc_date")).isEqualTo("20251203");
    }

    @Test
    void noteIsAlwaysBlank() {
        PeakRow row = new PeakRow();
        row.set(PeakColumn.T_NOTE, "some note");

        Map<String, Object> out = finalizer.finalizeRow(row, Platform.UNKNOWN, "", "", "", ExtractOptions.defaults());

        assertThat(out.get("T_note")).isEqualTo("");
    }

    @Test
    void descriptionCarriesSellerUsernameAndFileTags() {
        PeakRow row = new PeakRow();
        row.putHint("seller_id", "253227155");
        row.putHint("shop_name", "70mai");

        Map<String, Object> out = finalizer.finalizeRow(row, Platform.SHOPEE, "", "/tmp/in/Shopee-TIV-X.pdf",
                RABBIT, ExtractOptions.defaults());

        assertThat(out.get("L_description"))
                .isEqualTo("Shopee Marketplace Fee \u2014 SellerID=253227155 | Username=70mai | File=Shopee-TIV-X.pdf");
        assertThat(out.get("Q_payment_method")).isEqualTo("EWL001");
        assertThat(out.get("_wallet_code_resolved")).isEqualTo("EWL001");
    }

    @Test
    void finalizingTwiceDoesNotDuplicateTags() {
        PeakRow row = new PeakRow();
        row.putHint("seller_id", "253227155");
        Map<String, Object> first = finalizer.finalizeRow(row, Platform.SHOPEE, "", "x.pdf", RABBIT, ExtractOptions.defaults());

        Map<String, Object> second = finalizer.finalizeRow(PeakRow.fromMap(first), Platform.SHOPEE, "", "x.pdf",
                RABBIT, ExtractOptions.defaults());

        assertThat(second.get("L_description")).isEqualTo("Shopee Marketplace Fee \u2014 File=x.pdf");
        assertThat(second.get("R_paid_amount")).isEqualTo(first.get("R_paid_amount"));
    }

    @Test
    void companyNameAndMinimalDefaults() {
        Map<String, Object> out = finalizer.finalizeRow(new PeakRow(), Platform.META, "", "", RABBIT, ExtractOptions.defaults());

        assertThat(out.get("A_company_name")).isEqualTo("RABBIT");
        assertThat(out.get("M_qty")).isEqualTo("1");
        assertThat(out.get("J_price_type")).isEqualTo("3");
        assertThat(out.get("O_vat_rate")).isEqualTo("NO");
        assertThat(out.get("U_group")).isEqualTo("Advertising Expense");
    }

    @Test
    void glCodeFromOptionsBucketBeatsEverything() {
        settings.getGlCodes().put(ClientCompany.RABBIT, "999999");
        PeakRow row = new PeakRow();
        row.set(PeakColumn.K_ACCOUNT, "111111");

        ExtractOptions opts = ExtractOptions.from(Map.of("gl_code_map",
                "{\"" + RABBIT + "\": {\"MARKETPLACE\": \"520317\", \"DEFAULT\": \"520203\"}}"));
        Map<String, Object> out = finalizer.finalizeRow(row, Platform.LAZADA, "", "", RABBIT, opts);

        assertThat(out.get("K_account")).isEqualTo("520317");
    }

    @Test
    void glCodeFallsBackToOverrideThenExistingThenGroup() {
        PeakRow withExisting = new PeakRow();
        withExisting.set(PeakColumn.K_ACCOUNT, "111111");
        assertThat(finalizer.finalizeRow(withExisting, Platform.SHOPEE, "", "", RABBIT, ExtractOptions.defaults())
                .get("K_account")).isEqualTo("111111");

        assertThat(finalizer.finalizeRow(new PeakRow(), Platform.SHOPEE, "", "", RABBIT, ExtractOptions.defaults())
                .get("K_account")).isEqualTo("Marketplace Expense");

        settings.getGlCodes().put(ClientCompany.RABBIT, "520317");
        assertThat(finalizer.finalizeRow(withExisting.copy(), Platform.SHOPEE, "", "", RABBIT, ExtractOptions.defaults())
                .get("K_account")).isEqualTo("520317");
    }

    @Test
    void walletLeftBlankWhenNotFound() {
        PeakRow row = new PeakRow();
        row.putHint("seller_id", "999999999");

        Map<String, Object> out = finalizer.finalizeRow(row, Platform.SHOPEE, "", "", RABBIT, ExtractOptions.defaults());

        assertThat(out.get("Q_payment_method")).isEqualTo("");
        assertThat(out).doesNotContainKey("_wallet_code_resolved");
    }
}
