package com.conveyal.wtt.util.json;

import com.conveyal.wtt.TestGrids;
import com.conveyal.wtt.error.NewWTTErrorType;
import com.conveyal.wtt.validator.ValidationResult;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasSize;

public class JsonManagerTest {

    /**
     * The validation result written by the command line tool can be read back by other tools.
     */
    @Test
    public void canReadBackValidationResult() throws IOException {
        ValidationResult result = TestGrids.reconcile().getValidationResult();
        JsonManager<ValidationResult> json = new JsonManager<>(ValidationResult.class);
        String text = json.writePretty(result);
        assertThat(text, containsString("\"validLinkCount\" : 4"));

        ValidationResult read = json.read(text);
        assertThat(read.validLinkCount, equalTo(4));
        assertThat(read.conflicts, hasSize(2));
        assertThat(read.conflicts.get(0).derivedIds, contains("93005", "93006"));
        assertThat(read.undefinedIds.get("C"), contains("99999"));
        assertThat(read.errorCountsByType.get(NewWTTErrorType.UNDEFINED_SERVICE_ID), equalTo(1));
    }

}
