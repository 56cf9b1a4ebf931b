package com.receipt.extraction.model;

public enum AmountKind { SUBTOTAL, TAX, TOTAL }
