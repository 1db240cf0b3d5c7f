package com.niigaki.billing.application.dto;

import lombok.Builder;

@Builder
public record BillableTenant(
        String id,
        String name,
        String email,
        String cpfCnpj,
        String phone,
        String postalCode,
        String addressNumber
) {
}
