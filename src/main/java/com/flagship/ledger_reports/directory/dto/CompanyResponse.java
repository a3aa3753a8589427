package com.flagship.ledger_reports.directory.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.ledger_reports.directory.Company;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CompanyResponse {

    @JsonProperty("company_id")
    String companyId;

    @JsonProperty("company_name")
    String companyName;

    @JsonProperty("alter_id")
    String alterId;

    public static CompanyResponse from(Company company) {
        return CompanyResponse.builder()
            .companyId(company.getGuid())
            .companyName(company.getName())
            .alterId(company.getAlterId())
            .build();
    }
}
