package com.firmenakte.aggregate.model;

import java.util.Locale;

public record CompanyIdentity(
    String companyName,
    String registernummer,
    String ustIdnr
) {
    public boolean hasIdentifyingField() {
        return !isBlank(companyName) || !isBlank(registernummer) || !isBlank(ustIdnr);
    }

    public CompanyIdentity normalized() {
        return new CompanyIdentity(clean(companyName), cleanRegisternummer(registernummer), cleanUstIdnr(ustIdnr));
    }

    public CompanyIdentity withUstIdnr(String value) {
        return new CompanyIdentity(companyName, registernummer, cleanUstIdnr(value));
    }

    public boolean hasCompanyName() {
        return !isBlank(companyName);
    }

    public boolean hasRegisternummer() {
        return !isBlank(registernummer);
    }

    public boolean hasUstIdnr() {
        return !isBlank(ustIdnr);
    }

    public String displayName() {
        if (hasCompanyName()) {
            return companyName;
        }
        if (hasRegisternummer()) {
            return registernummer;
        }
        return ustIdnr;
    }

    private static String clean(String value) {
        if (isBlank(value)) {
            return null;
        }
        return value.trim().replaceAll("\\s+", " ");
    }

    private static String cleanRegisternummer(String value) {
        String cleaned = clean(value);
        return cleaned == null ? null : cleaned.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    private static String cleanUstIdnr(String value) {
        String cleaned = clean(value);
        return cleaned == null ? null : cleaned.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
