package com.dataflow.sdg.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Routes one data product to a file of a given technology. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PersistenceItem {
    private String productName;
    private String fileName;
    private Technology technology;
}
