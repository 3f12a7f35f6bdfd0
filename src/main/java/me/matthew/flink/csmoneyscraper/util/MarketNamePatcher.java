package me.matthew.flink.csmoneyscraper.util;

import java.util.regex.Pattern;

/**
 * Default name normalizer.
 * cs.money appends the Doppler phase or gem to the finish ("Doppler Phase 2", "Gamma Doppler Emerald")
 * while the market lists all phases under the plain finish name.
 */
public class MarketNamePatcher implements MarketNameNormalizer {

    private static final Pattern DOPPLER_VARIANT = Pattern.compile(
            "(Doppler)\\s+(?:Phase\\s*[1-4]|Ruby|Sapphire|Black\\s+Pearl|Emerald)(?=\\s*\\(|\\s*$)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    @Override
    public String normalize(String name) {
        if (name == null) {
            return null;
        }
        String patched = DOPPLER_VARIANT.matcher(name).replaceAll("$1");
        return WHITESPACE.matcher(patched).replaceAll(" ").trim();
    }
}
