package com.firmenakte.aggregate.persistence;

import com.firmenakte.aggregate.model.CompanyIdentity;
import com.firmenakte.aggregate.util.HashUtils;

import java.util.Locale;

/**
 * Stable key for a company across runs: the register number when known, else the normalized name,
 * else the VAT id. {@code hash} is the SHA-256 of {@code key} and is what the API and storage use.
 */
public record IdentityFingerprint(String key, String hash) {

    public static IdentityFingerprint of(CompanyIdentity identity) {
        CompanyIdentity normalized = identity.normalized();
        String key;
        if (normalized.hasRegisternummer()) {
            key = "reg:" + normalized.registernummer().replace(" ", "").toUpperCase(Locale.ROOT);
        } else if (normalized.hasCompanyName()) {
            key = "name:" + normalized.companyName().toLowerCase(Locale.ROOT);
        } else if (normalized.hasUstIdnr()) {
            key = "ust:" + normalized.ustIdnr();
        } else {
            throw new IllegalArgumentException("Identity has no identifying field");
        }
        return new IdentityFingerprint(key, HashUtils.sha256Hex(key));
    }
}
