package com.example.peak.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.example.peak.model.PeakColumn;
import com.example.peak.model.PeakRow;
import com.example.peak.utils.DateUtils;
import com.example.peak.utils.TaxIdUtils;

/**
 * 형식 검증. 오류는 메시지 목록으로만 돌려주고 예외를 던지지 않는다.
 */
@Component
public class RowValidator {

    static final Set<String> PRICE_TYPES = Set.of("1", "2", "3");
    static final Set<String> VAT_RATES = Set.of("7%", "0%", "7", "0", "NO");

    public List<String> validate(PeakRow row) {
        List<String> errors = new ArrayList<>();

        if (!DateUtils.isValidYyyymmdd(row.get(PeakColumn.B_DOC_DATE))) {
            errors.add("invalid document date (B_doc_date, expected yyyyMMdd)");
        }
        if (!row.isBlank(PeakColumn.H_INVOICE_DATE) && !DateUtils.isValidYyyymmdd(row.get(PeakColumn.H_INVOICE_DATE))) {
            errors.add("invalid invoice date (H_invoice_date, expected yyyyMMdd)");
        }
        if (!row.isBlank(PeakColumn.I_TAX_PURCHASE_DATE) && !DateUtils.isValidYyyymmdd(row.get(PeakColumn.I_TAX_PURCHASE_DATE))) {
            errors.add("invalid tax purchase date (I_tax_purchase_date, expected yyyyMMdd)");
        }
        if (!row.isBlank(PeakColumn.F_BRANCH_5) && !TaxIdUtils.isBranch5(row.get(PeakColumn.F_BRANCH_5))) {
            errors.add("branch code is not 5 digits (F_branch_5)");
        }
        if (!row.isBlank(PeakColumn.E_TAX_ID_13) && !TaxIdUtils.isTaxId13(row.get(PeakColumn.E_TAX_ID_13))) {
            errors.add("tax id is not 13 digits (E_tax_id_13)");
        }
        if (!row.isBlank(PeakColumn.J_PRICE_TYPE) && !PRICE_TYPES.contains(row.get(PeakColumn.J_PRICE_TYPE).trim())) {
            errors.add("unknown price type (J_price_type)");
        }
        if (!row.isBlank(PeakColumn.O_VAT_RATE) && !VAT_RATES.contains(row.get(PeakColumn.O_VAT_RATE).trim().toUpperCase())) {
            errors.add("unknown VAT rate (O_vat_rate)");
        }
        return errors;
    }
}
