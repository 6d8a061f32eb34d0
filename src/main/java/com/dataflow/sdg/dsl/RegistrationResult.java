package com.dataflow.sdg.dsl;

/**
 * Outcome of committing one declaration statement.
 *
 * @param name     full name of the declared node
 * @param inserted false if the name was already taken; the duplicate is then
 *                 reported in the catalog's error list
 */
public record RegistrationResult(String name, boolean inserted) {
}
