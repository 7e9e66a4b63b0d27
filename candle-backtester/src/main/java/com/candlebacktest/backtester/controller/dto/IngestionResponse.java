package com.candlebacktest.backtester.controller.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResponse {

    private String symbol;
    private int inserted;
}
