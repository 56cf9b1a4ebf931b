package com.receipt.extraction.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Known-correct field values for a sample document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GroundTruth {

    private String vendor;
    private String date;                 // ISO yyyy-MM-dd
    private Double subtotal;
    private Double tax;
    private Double total;

    @Builder.Default
    private int expectedWordsMin = 20;
}
