package org.cleanseam.engine.domain.service;

import org.cleanseam.engine.TestCatalogs;
import org.cleanseam.engine.catalog.Catalog;
import org.cleanseam.engine.domain.exception.AnalysisException;
import org.cleanseam.engine.domain.model.AnalysisInput;
import org.cleanseam.engine.domain.model.AnalysisRequest;
import org.cleanseam.engine.domain.model.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class RequestValidatorTest {

    private final RequestValidator validator = new RequestValidator();
    private final Catalog catalog = TestCatalogs.bundled();

    private ErrorKind failureOf(AnalysisInput input) {
        return assertThrows(AnalysisException.class, () -> validator.validate(input, catalog)).getErrorKind();
    }

    @Test
    void validInput_isNormalized() {
        AnalysisRequest request = validator.validate(new AnalysisInput("  PataGonia  ", " JEANS ", "49.99"), catalog);

        assertEquals("patagonia", request.getBrandKey());
        assertEquals("PataGonia", request.getSubmittedBrand());
        assertEquals("jeans", request.getCategory().getItemType());
        assertEquals(49.99, request.getPrice());
        assertEquals("USD", request.getCurrency());
    }

    @Test
    void currency_isCarriedThrough() {
        AnalysisRequest request = validator.validate(new AnalysisInput("Zara", "jeans", "39", "EUR"), catalog);
        assertEquals("EUR", request.getCurrency());
    }

    @Test
    void unknownBrand_isNotAFailure() {
        AnalysisRequest request = validator.validate(new AnalysisInput("NoName", "jeans", "20"), catalog);
        assertEquals("noname", request.getBrandKey());
    }

    @Test
    void blankBrand_becomesUnknown() {
        AnalysisRequest request = validator.validate(new AnalysisInput("   ", "jeans", "20"), catalog);
        assertEquals("Unknown", request.getSubmittedBrand());
        assertEquals("unknown", request.getBrandKey());

        assertEquals("unknown", validator.validate(new AnalysisInput(null, "jeans", "20"), catalog).getBrandKey());
    }

    @Test
    void missingPrice_isInvalidPrice() {
        assertEquals(ErrorKind.INVALID_PRICE, failureOf(new AnalysisInput("Zara", "jeans", (String) null)));
        assertEquals(ErrorKind.INVALID_PRICE, failureOf(new AnalysisInput("Zara", "jeans", "  ")));
    }

    @Test
    void nonNumericPrice_isInvalidPrice() {
        for (String raw : new String[]{"abc", "12,50", "NaN", "Infinity", "5d", "0x10"}) {
            assertEquals(ErrorKind.INVALID_PRICE, failureOf(new AnalysisInput("Zara", "jeans", raw)),
                    "Expected INVALID_PRICE for " + raw);
        }
    }

    @Test
    void nonPositivePrice_isInvalidPrice() {
        for (String raw : new String[]{"0", "0.00", "-5", "-0.01", "1e400"}) {
            assertEquals(ErrorKind.INVALID_PRICE, failureOf(new AnalysisInput("Zara", "jeans", raw)),
                    "Expected INVALID_PRICE for " + raw);
        }
    }

    @Test
    void unknownCategory_failsRegardlessOfBrand() {
        assertEquals(ErrorKind.UNKNOWN_CATEGORY, failureOf(new AnalysisInput("Patagonia", "socks", "20")));
        assertEquals(ErrorKind.UNKNOWN_CATEGORY, failureOf(new AnalysisInput("NoName", "socks", "20")));
        assertEquals(ErrorKind.UNKNOWN_CATEGORY, failureOf(new AnalysisInput("Zara", null, "20")));
    }

    @Test
    void unknownCategory_reportedBeforeBadPrice() {
        assertEquals(ErrorKind.UNKNOWN_CATEGORY, failureOf(new AnalysisInput("Zara", "socks", "-1")));
    }
}
