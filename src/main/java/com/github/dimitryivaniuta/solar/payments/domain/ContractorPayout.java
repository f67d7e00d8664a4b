package com.github.dimitryivaniuta.solar.payments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Bank details the admin used when paying out the contractor. All fields optional.
 */
@Embeddable
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ContractorPayout {

    @Column(name = "contractor_bank_name", length = 128)
    private String bankName;

    @Column(name = "contractor_iban", length = 64)
    private String iban;

    @Column(name = "contractor_account_holder", length = 128)
    private String accountHolder;
}
