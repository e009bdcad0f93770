package io.restactions.core;

import io.restactions.json.jackson.JacksonJsonCodec;
import io.restactions.json.spi.JsonCodec;

final class Fixtures {
    private Fixtures() {}

    static final JsonCodec CODEC = new JacksonJsonCodec();

    record Company(String id, String name) {}

    record Customer(String name, String dv, String email) {}

    record InvoiceDraft(String number, Customer customer, String notes) {}

    record Payroll(String id, String status) {}

    record PayrollFile(String url) {}

    record Counted(String id, int count) {}

    static ActionRegistry<Company> companies(String unwrapKey) {
        return ActionRegistry.builder(Company.class)
                .get(unwrapKey)
                .update(unwrapKey)
                .build();
    }
}
