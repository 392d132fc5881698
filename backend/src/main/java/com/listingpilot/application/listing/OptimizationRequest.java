package com.listingpilot.application.listing;

import com.listingpilot.domain.keyword.model.AccountType;
import com.listingpilot.domain.keyword.model.Keyword;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Input of a full listing optimization.
 *
 * @param productTitle working product name
 * @param brand        brand name
 * @param productLine  optional product line (nullable)
 * @param keywords     researched keywords, any order
 * @param marketplace  marketplace id (nullable, defaults to the configured marketplace)
 * @param accountType  seller or vendor (nullable, defaults to seller)
 * @param category     product category, selects the bullet limit (nullable)
 * @param language     explicit listing language (nullable, defaults to the marketplace language)
 */
public record OptimizationRequest(
        @NotBlank(message = "Product title is required")
        @Size(max = 500, message = "Product title must not exceed 500 characters")
        String productTitle,

        @NotBlank(message = "Brand is required")
        @Size(max = 100, message = "Brand must not exceed 100 characters")
        String brand,

        String productLine,

        @NotEmpty(message = "At least one keyword is required")
        List<@NotNull Keyword> keywords,

        String marketplace,

        AccountType accountType,

        String category,

        String language
) {}
