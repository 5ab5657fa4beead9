package com.firmenakte.aggregate.persistence;

import com.firmenakte.aggregate.model.CompanyIdentity;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityFingerprintTest {

    @Test
    void registerNumberWinsOverName() {
        IdentityFingerprint withName = IdentityFingerprint.of(new CompanyIdentity("MAGNA GmbH", "HRB 12345", null));
        IdentityFingerprint registerOnly = IdentityFingerprint.of(new CompanyIdentity(null, "hrb12345", null));

        assertThat(withName.key()).isEqualTo("reg:HRB12345");
        assertThat(registerOnly.hash()).isEqualTo(withName.hash());
        assertThat(withName.hash()).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void nameIsCaseAndWhitespaceInsensitive() {
        IdentityFingerprint first = IdentityFingerprint.of(new CompanyIdentity("  MAGNA   Powertrain GmbH ", null, null));
        IdentityFingerprint second = IdentityFingerprint.of(new CompanyIdentity("magna powertrain gmbh", null, null));

        assertThat(first.key()).isEqualTo("name:magna powertrain gmbh");
        assertThat(first).isEqualTo(second);
    }

    @Test
    void fallsBackToVatId() {
        assertThat(IdentityFingerprint.of(new CompanyIdentity(null, null, "de 123456789")).key())
            .isEqualTo("ust:DE123456789");
        assertThatThrownBy(() -> IdentityFingerprint.of(new CompanyIdentity(" ", null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
