package com.taxprep.fdg.model;

import java.time.LocalDate;

/**
 * Primary taxpayer or spouse.
 *
 * @param blind             true if the person is legally blind at year end
 * @param taxpayerDependent true if someone else can claim this person as a
 *                          dependent
 */
public record Person(String firstName, String lastName, String ssid, LocalDate dateOfBirth,
        boolean blind, boolean taxpayerDependent) {
}
