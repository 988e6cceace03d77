package com.example.peak.model;

import java.util.HashMap;
import java.util.Map;

/**
 * PEAK 임포트 컬럼 (A~U, 22개). 선언 순서가 곧 출력 순서다.
 */
public enum PeakColumn {

    A_SEQ("A_seq"),
    A_COMPANY_NAME("A_company_name"),
    B_DOC_DATE("B_doc_date"),
    C_REFERENCE("C_reference"),
    D_VENDOR_CODE("D_vendor_code"),
    E_TAX_ID_13("E_tax_id_13"),
    F_BRANCH_5("F_branch_5"),
    G_INVOICE_NO("G_invoice_no"),
    H_INVOICE_DATE("H_invoice_date"),
    I_TAX_PURCHASE_DATE("I_tax_purchase_date"),
    J_PRICE_TYPE("J_price_type"),
    K_ACCOUNT("K_account"),
    L_DESCRIPTION("L_description"),
    M_QTY("M_qty"),
    N_UNIT_PRICE("N_unit_price"),
    O_VAT_RATE("O_vat_rate"),
    P_WHT("P_wht"),
    Q_PAYMENT_METHOD("Q_payment_method"),
    R_PAID_AMOUNT("R_paid_amount"),
    S_PND("S_pnd"),
    T_NOTE("T_note"),
    U_GROUP("U_group");

    /** 진단용 내부 키 prefix */
    public static final String INTERNAL_PREFIX = "_";

    private static final Map<String, PeakColumn> BY_KEY = new HashMap<>();

    static {
        for (PeakColumn c : values()) BY_KEY.put(c.key, c);
    }

    private final String key;

    PeakColumn(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static PeakColumn fromKey(String key) {
        if (key == null) return null;
        return BY_KEY.get(key);
    }

    public static boolean isInternalKey(String key) {
        return key != null && key.startsWith(INTERNAL_PREFIX);
    }
}
