// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.parser;

import strictml.util.condition.Condition;

/**
 * A condition type indicating that the HTML source could not be parsed.
 */
public final class ParseErrorCondition extends Condition {
    ParseErrorCondition(final ParseError error) {
        super(error.message());
        this.error = error;
    }

    /**
     * Returns the error, including its location.
     */
    public ParseError error() {
        return error;
    }

    @Override
    public String detailedMessage() {
        return error.toString();
    }

    private final ParseError error;
}
