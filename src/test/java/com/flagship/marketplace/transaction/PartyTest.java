package com.flagship.marketplace.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class PartyTest {

    @Test
    @DisplayName("Labels used in system messages do not depend on the default locale")
    void labelsIgnoreLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("buyer", Party.BUYER.label());
            assertEquals("seller", Party.SELLER.label());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
