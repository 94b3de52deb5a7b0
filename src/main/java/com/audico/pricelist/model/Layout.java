package com.audico.pricelist.model;

public enum Layout {
    /** Several brands side by side, brand names as column headers. */
    HORIZONTAL,
    /** One brand per sheet, products listed top to bottom. */
    VERTICAL
}
