package com.cred.freestyle.stockcount.domain.model;

import jakarta.validation.constraints.NotBlank;

/**
 * One tag read submitted in a stock take.
 *
 * @author Stock Count Team
 */
public class ProductIdentifier {

    @NotBlank(message = "Tag ID is required")
    private String tagIdHex;

    public ProductIdentifier() {
    }

    public ProductIdentifier(String tagIdHex) {
        this.tagIdHex = tagIdHex;
    }

    public String getTagIdHex() {
        return tagIdHex;
    }

    public void setTagIdHex(String tagIdHex) {
        this.tagIdHex = tagIdHex;
    }
}
