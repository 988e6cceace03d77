package com.example.peak.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.utils.DateUtils;
import com.example.peak.utils.MoneyUtils;

/**
 * TikTok Shop 세금계산서/영수증.
 * R_paid_amount 에는 VAT 포함 총액(세전 WHT)을 넣는다. 순지급액 계산은 WHT 정책 단계에서.
 */
@Component
public class TikTokRowExtractor extends BaseRowExtractor {

    // TTSTH20250008665805
    private static final Pattern RE_INVOICE_NO = Pattern.compile("\\b(TTSTH\\d{8,})\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_INVOICE_NUMBER_LINE = Pattern.compile(
            "invoice\\s*(?:no|number)\\.?\\s*[:：#\\-]?\\s*([A-Za-z0-9][A-Za-z0-9\\-_/]{6,})", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_INVOICE_DATE_LINE = Pattern.compile(
            "invoice\\s*date\\s*[:：\\-]?\\s*(.+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_VENDOR_TAX_LINE = Pattern.compile(
            "tax\\s*registration\\s*number\\s*[:：\\-]?\\s*(\\d{13})", Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_DATE_YMD = Pattern.compile("\\b(\\d{4})[-/](\\d{1,2})[-/](\\d{1,2})\\b");
    private static final Pattern RE_DATE_MON_DD_YYYY = Pattern.compile(
            "\\b(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{1,2}),\\s*(\\d{4})\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern RE_TOTAL_INCL = Pattern.compile(
            "total\\s*amount\\s*\\(\\s*including\\s*vat\\s*\\)|total\\s*amount.*including\\s*vat"
                    + "|amount\\s*in\\s*thb\\s*\\(\\s*including\\s*vat\\s*\\)|grand\\s*total|amount\\s*due",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_TOTAL_VAT = Pattern.compile(
            "total\\s*vat\\s*7%|total\\s*vat|vat\\s*amount|value\\s*added\\s*tax", Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_SUBTOTAL_EXCL = Pattern.compile(
            "subtotal\\s*\\(\\s*excluding\\s*vat\\s*\\)|subtotal.*excluding\\s*vat|total.*excluding\\s*vat"
                    + "|amount\\s*in\\s*thb\\s*\\(\\s*excluding\\s*vat\\s*\\)",
            Pattern.CASE_INSENSITIVE);

    // "withheld tax at the rate of 3% amounting to ฿4,414.88"
    private static final Pattern RE_WHT_AMOUNTING = Pattern.compile(
            "(?:withheld|withholding)\\s*tax.*?rate\\s*of\\s*(\\d{1,2})\\s*%.*?amounting\\s*to\\s*฿?\\s*([0-9,]+(?:\\.[0-9]{1,2})?)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    // 광고비 청구서
    private static final Pattern RE_ADS_HINT = Pattern.compile(
            "\\b(?:ads|advertising|promotion)\\b|โฆษณา", Pattern.CASE_INSENSITIVE);

    @Override
    public String method() {
        return "rule_based_tiktok";
    }

    @Override
    public PeakRow extract(ExtractRequest request) {
        String t = normalizeText(request.getText());
        PeakRow row = blankRow();
        if (t.isBlank()) return row;

        // --- 인보이스 번호 ---
        String invNo = safe(firstNonNull(extract(t, RE_INVOICE_NO), extract(t, RE_INVOICE_NUMBER_LINE)));
        if (!invNo.isEmpty()) {
            row.set(PeakColumn.C_REFERENCE, invNo);
            row.set(PeakColumn.G_INVOICE_NO, invNo);
        }

        // --- 판매자(TikTok) 납세자번호 / 지점 ---
        row.set(PeakColumn.E_TAX_ID_13, vendorTaxId(t, RE_VENDOR_TAX_LINE, request.getClientTaxId()));
        row.set(PeakColumn.F_BRANCH_5, branch(t));

        // --- 날짜 ---
        String docDate = invoiceDate(t);
        if (!docDate.isEmpty()) {
            row.set(PeakColumn.B_DOC_DATE, docDate);
            row.set(PeakColumn.H_INVOICE_DATE, docDate);
            row.set(PeakColumn.I_TAX_PURCHASE_DATE, docDate);
        }

        // --- 금액 ---
        String subtotalEx = amountNearKeyword(t, RE_SUBTOTAL_EXCL, 120);
        String vatAmt = amountNearKeyword(t, RE_TOTAL_VAT, 120);
        String totalIncl = amountNearKeyword(t, RE_TOTAL_INCL, 120);
        if (totalIncl.isEmpty() && !subtotalEx.isEmpty() && !vatAmt.isEmpty()) {
            totalIncl = MoneyUtils.format2(MoneyUtils.toAmount(subtotalEx) + MoneyUtils.toAmount(vatAmt));
        }
        if (totalIncl.isEmpty()) totalIncl = subtotalEx;

        if (!totalIncl.isEmpty()) {
            row.set(PeakColumn.N_UNIT_PRICE, totalIncl);
            row.set(PeakColumn.R_PAID_AMOUNT, totalIncl);
        }
        if (!subtotalEx.isEmpty()) row.putHint("subtotal_ex_vat", subtotalEx);
        if (!vatAmt.isEmpty()) row.putHint("vat_amount", vatAmt);

        // --- WHT (대부분 3%, 금액 명시) ---
        Matcher wht = RE_WHT_AMOUNTING.matcher(t);
        if (wht.find()) {
            String amt = MoneyUtils.normalizeAmount(wht.group(2));
            if (!amt.isEmpty()) {
                row.set(PeakColumn.P_WHT, amt);
                row.putHint("wht_rate_percent", wht.group(1));
            }
        }

        row.set(PeakColumn.U_GROUP, RE_ADS_HINT.matcher(t).find() ? "Advertising Expense" : "Marketplace Expense");
        return row;
    }

    private PeakRow blankRow() {
        PeakRow row = new PeakRow();
        row.set(PeakColumn.D_VENDOR_CODE, "Unknown");
        row.set(PeakColumn.F_BRANCH_5, "00000");
        row.set(PeakColumn.J_PRICE_TYPE, "1");
        row.set(PeakColumn.M_QTY, "1");
        row.set(PeakColumn.N_UNIT_PRICE, "0.00");
        row.set(PeakColumn.O_VAT_RATE, "7%");
        row.set(PeakColumn.R_PAID_AMOUNT, "0.00");
        row.set(PeakColumn.U_GROUP, "Marketplace Expense");
        return row;
    }

    /**
     * "Invoice date" 줄 우선, 없으면 본문의 첫 날짜
     */
    String invoiceDate(String t) {
        String line = extract(t, RE_INVOICE_DATE_LINE);
        if (line != null) {
            String d = dateFrom(line);
            if (!d.isEmpty()) return d;
        }
        return dateFrom(t);
    }

    private String dateFrom(String s) {
        Matcher m = RE_DATE_YMD.matcher(s);
        if (m.find()) {
            String d = DateUtils.toDocDate(m.group(1) + "-" + m.group(2) + "-" + m.group(3));
            if (!d.isEmpty()) return d;
        }
        // "December 3, 2025" / "Sept. 3,2025" -> "Dec 3, 2025"
        Matcher m2 = RE_DATE_MON_DD_YYYY.matcher(s);
        if (m2.find()) {
            return DateUtils.toDocDate(m2.group(1) + " " + m2.group(2) + ", " + m2.group(3));
        }
        return "";
    }
}
