package com.nikoh.matchmaking.service.mrz;

import java.util.Locale;
import java.util.Map;

/**
 * Country names for the three letter codes printed in travel documents.
 */
public final class CountryCodes {

    private static final Map<String, String> NAMES = Map.ofEntries(
            // Central Asia
            Map.entry("UZB", "Uzbekistan"),
            Map.entry("KAZ", "Kazakhstan"),
            Map.entry("TJK", "Tajikistan"),
            Map.entry("KGZ", "Kyrgyzstan"),
            Map.entry("TKM", "Turkmenistan"),
            Map.entry("AFG", "Afghanistan"),
            // CIS and neighbours
            Map.entry("RUS", "Russia"),
            Map.entry("UKR", "Ukraine"),
            Map.entry("BLR", "Belarus"),
            Map.entry("AZE", "Azerbaijan"),
            Map.entry("ARM", "Armenia"),
            Map.entry("GEO", "Georgia"),
            Map.entry("MDA", "Moldova"),
            // Major destinations and nationalities
            Map.entry("USA", "United States"),
            Map.entry("CAN", "Canada"),
            Map.entry("GBR", "United Kingdom"),
            Map.entry("DEU", "Germany"),
            Map.entry("D", "Germany"),
            Map.entry("FRA", "France"),
            Map.entry("ITA", "Italy"),
            Map.entry("ESP", "Spain"),
            Map.entry("POL", "Poland"),
            Map.entry("CZE", "Czech Republic"),
            Map.entry("TUR", "Turkey"),
            Map.entry("ARE", "United Arab Emirates"),
            Map.entry("SAU", "Saudi Arabia"),
            Map.entry("QAT", "Qatar"),
            Map.entry("EGY", "Egypt"),
            Map.entry("IRN", "Iran"),
            Map.entry("PAK", "Pakistan"),
            Map.entry("IND", "India"),
            Map.entry("KOR", "South Korea"),
            Map.entry("JPN", "Japan"),
            Map.entry("CHN", "China"),
            Map.entry("MYS", "Malaysia"),
            Map.entry("IDN", "Indonesia"),
            Map.entry("AUS", "Australia"));

    private CountryCodes() {
    }

    /**
     * Full country name, or the code unchanged when unknown
     */
    public static String nameOf(String code) {
        if (code == null) {
            return null;
        }
        String normalized = code.replace(String.valueOf(MrzParser.FILLER), "").trim().toUpperCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return code;
        }
        return NAMES.getOrDefault(normalized, code);
    }
}
