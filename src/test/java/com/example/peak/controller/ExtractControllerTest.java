package com.example.peak.controller;

import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import com.google.gson.Gson;

@SpringBootTest
@AutoConfigureMockMvc
class ExtractControllerTest {

    private static final String TIKTOK_INVOICE = String.join("\n",
            "TikTok Shop (Thailand) Ltd.",
            "Tax Registration Number: 0105566214176",
            "Tax Invoice / Receipt",
            "Invoice No: TTSTH20250008665805",
            "Invoice date: Dec 3, 2025",
            "Subtotal (excluding VAT): 147,162.62",
            "Total VAT 7%: 10,301.38",
            "Total amount (including VAT): 157,464.00",
            "The buyer has withheld tax at the rate of 3% amounting to ฿4,414.88");

    private final Gson gson = new Gson();

    @Autowired
    MockMvc mockMvc;

    @Test
    void extractReturnsLockedRowWithNetPaidAmount() throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", TIKTOK_INVOICE);
        body.put("filename", "uploads/TTSTH20250008665805.pdf");
        body.put("clientTaxId", "0105561071873");

        mockMvc.perform(post("/peak/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(gson.toJson(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.platform").value("TIKTOK"))
                .andExpect(jsonPath("$.errors").isEmpty())
                .andExpect(jsonPath("$.row.A_company_name").value("RABBIT"))
                .andExpect(jsonPath("$.row.B_doc_date").value("20251203"))
                .andExpect(jsonPath("$.row.C_reference").value("TTSTH20250008665805"))
                .andExpect(jsonPath("$.row.G_invoice_no").value("TTSTH20250008665805"))
                .andExpect(jsonPath("$.row.P_wht").value("4414.88"))
                .andExpect(jsonPath("$.row.R_paid_amount").value("153049.12"))
                .andExpect(jsonPath("$.row.S_pnd").value("53"))
                .andExpect(jsonPath("$.row.T_note").value(""))
                .andExpect(jsonPath("$.row._platform").value("TIKTOK"))
                .andExpect(jsonPath("$.row._extraction_method").value("rule_based_tiktok"));
    }

    @Test
    void extractWithoutTextIsBadRequest() throws Exception {
        mockMvc.perform(post("/peak/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\":\"a.pdf\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("text is required")));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/peak/extract")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void finalizeLocksLooseRow() throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("C_reference", "");
        row.put("G_invoice_no", "");
        row.put("T_note", "should be cleared");
        row.put("extra_field", "dropped");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("row", row);
        body.put("platform", "META");
        body.put("text", "Meta Platforms Ireland Ltd.\nReceipt for Payment\nInvoice Date: 2025-11-02");
        body.put("filename", "meta.pdf");

        mockMvc.perform(post("/peak/finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(gson.toJson(body)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.T_note").value(""))
                .andExpect(jsonPath("$.B_doc_date").value("20251102"))
                .andExpect(jsonPath("$.U_group").value("Advertising Expense"))
                .andExpect(jsonPath("$.O_vat_rate").value("NO"))
                .andExpect(jsonPath("$.extra_field").doesNotExist());
    }

    @Test
    void finalizeWithoutRowIsBadRequest() throws Exception {
        mockMvc.perform(post("/peak/finalize")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"platform\":\"META\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string(containsString("row is required")));
    }
}
