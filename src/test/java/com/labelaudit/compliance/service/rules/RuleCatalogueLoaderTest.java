package com.labelaudit.compliance.service.rules;

import com.labelaudit.compliance.config.ComplianceConfig;
import com.labelaudit.compliance.exception.ErrorKind;
import com.labelaudit.compliance.exception.RuleCatalogueException;
import com.labelaudit.compliance.model.FieldName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RuleCatalogueLoaderTest {

    private final RuleCatalogueLoader loader =
            new RuleCatalogueLoader(ComplianceConfig.defaultObjectMapper(), new DefaultResourceLoader());

    private RuleCatalogueException failure(String location) {
        RuleCatalogueException e = assertThrows(RuleCatalogueException.class, () -> loader.load(location));
        assertEquals(ErrorKind.CONFIG, e.getKind());
        return e;
    }

    @Test
    public void bundledCatalogueLoads() {
        RuleCatalogue c = loader.load("classpath:rule-catalogue.json");
        assertEquals("lm-2011.1", c.getVersion());
        assertEquals(10, c.getRules().size());
        assertEquals(4, c.getRequiredCount());
        assertEquals(List.of(FieldName.MRP, FieldName.NET_QUANTITY, FieldName.MANUFACTURER_NAME,
                FieldName.COUNTRY_OF_ORIGIN), c.requiredFields());
    }

    @Test
    public void missingResourceFails() {
        assertTrue(failure("classpath:catalogues/nope.json").getMessage().contains("not found"));
    }

    @Test
    public void blankLocationFails() {
        failure(" ");
    }

    @Test
    public void emptyFileFails() {
        failure("classpath:catalogues/empty.json");
    }

    @Test
    public void catalogueWithoutVersionFails() {
        assertTrue(failure("classpath:catalogues/unversioned.json").getMessage().contains("no version"));
    }

    @Test
    public void unknownValidatorFails() {
        assertTrue(failure("classpath:catalogues/unknown-validator.json").getMessage().contains("zipcode"));
    }

    @Test
    public void catalogueWithoutRequiredFieldsFails() {
        failure("classpath:catalogues/no-required.json");
    }

    @Test
    public void catalogueWithoutFieldsFails() {
        failure("classpath:catalogues/blank.json");
    }

    @Test
    public void unknownFieldFails() {
        assertTrue(failure("classpath:catalogues/unknown-field.json").getMessage().contains("ingredients"));
    }

    @Test
    public void invalidJsonFails() {
        ByteArrayInputStream in = new ByteArrayInputStream("{\"version\": ".getBytes(StandardCharsets.UTF_8));
        RuleCatalogueException e = assertThrows(RuleCatalogueException.class, () -> loader.parse(in, "inline"));
        assertTrue(e.getMessage().contains("not valid JSON"));
    }

    @Test
    public void duplicateRulesAreRejectedByConstructor() {
        RuleCatalogue c = loader.load("classpath:rule-catalogue.json");
        FieldRule mrp = c.getRules().get(0);
        assertThrows(RuleCatalogueException.class, () -> new RuleCatalogue("x", List.of(mrp, mrp)));
    }
}
