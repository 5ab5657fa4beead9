package com.firmenakte.aggregate.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.firmenakte.aggregate.model.CompanyIdentity;

public record AggregationApiRequest(
    @JsonProperty("company_name") @JsonAlias("companyName") String companyName,
    @JsonProperty("registernummer") @JsonAlias("registerNumber") String registernummer,
    @JsonProperty("ust_idnr") @JsonAlias({"ustIdnr", "vat_id"}) String ustIdnr
) {
    public CompanyIdentity toIdentity() {
        return new CompanyIdentity(companyName, registernummer, ustIdnr);
    }
}
