// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package strictml.util.condition.exception;

import java.io.IOException;

/**
 * Signaled when reading input fails with an {@link IOException}.
 */
public final class IOExceptionCondition extends ExceptionCondition<IOException> {
    public IOExceptionCondition(final IOException exception) {
        super(exception);
    }
}
