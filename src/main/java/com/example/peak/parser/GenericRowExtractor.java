package com.example.peak.parser;

import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.utils.DateUtils;

/**
 * 전용 extractor 가 없는 문서용 (폴백).
 * 날짜 / 판매자 납세자번호 / 지점 / 인보이스 번호 / 총액 정도만 가볍게 뽑는다.
 */
@Component
public class GenericRowExtractor extends BaseRowExtractor {

    private static final Pattern RE_TAX_LABELED = Pattern.compile(
            "(?:tax\\s*(?:id|registration\\s*(?:number|no\\.?))|เลขประจำตัวผู้เสียภาษี(?:อากร)?)\\s*[:：\\-]?\\s*(\\d[\\d\\s-]{11,20}\\d)",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_INVOICE_NO = Pattern.compile(
            "(?:invoice\\s*(?:no|number)|receipt\\s*(?:no|number)|เลขที่(?:ใบกำกับภาษี)?)\\.?\\s*[:：#\\-]?\\s*([A-Za-z0-9][A-Za-z0-9\\-_/]{5,})",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern RE_GRAND_TOTAL = Pattern.compile(
            "grand\\s*total|total\\s*amount|amount\\s*due|จำนวนเงินรวมทั้งสิ้น|รวมทั้งสิ้น|ยอดรวมสุทธิ|ยอดรวม",
            Pattern.CASE_INSENSITIVE);

    @Override
    public String method() {
        return "generic";
    }

    @Override
    public PeakRow extract(ExtractRequest request) {
        String t = normalizeText(request.getText());
        PeakRow row = new PeakRow();
        row.set(PeakColumn.M_QTY, "1");
        if (t.isBlank()) return row;

        String docDate = DateUtils.docDateFromText(t);
        if (!docDate.isEmpty()) {
            row.set(PeakColumn.B_DOC_DATE, docDate);
            row.set(PeakColumn.H_INVOICE_DATE, docDate);
            row.set(PeakColumn.I_TAX_PURCHASE_DATE, docDate);
        }

        String vendorTax = vendorTaxId(t, RE_TAX_LABELED, request.getClientTaxId());
        if (!vendorTax.isEmpty()) {
            row.set(PeakColumn.E_TAX_ID_13, vendorTax);
            row.set(PeakColumn.F_BRANCH_5, branch(t));
        }

        String invNo = safe(extract(t, RE_INVOICE_NO));
        if (!invNo.isEmpty()) row.set(PeakColumn.G_INVOICE_NO, invNo);

        String total = amountNearKeyword(t, RE_GRAND_TOTAL, 80);
        if (!total.isEmpty()) {
            row.set(PeakColumn.N_UNIT_PRICE, total);
            row.set(PeakColumn.R_PAID_AMOUNT, total);
        }
        return row;
    }
}
