// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.chunked.util;

import java.util.HexFormat;
import java.util.UUID;

public abstract class RandomId {
    /// Task IDs are used as directory names for temporary and result files, so they should not be
    /// case-sensitive in case the filesystem is not.
    public static String createRandomStringId () {
        return UUID.randomUUID().toString().replaceAll("-", "");
    }

    public static boolean validRandomStringId (String id) {
        if (id == null || id.length() != 32) return false;
        for (int i = 0; i < id.length(); i++) {
            if (!HexFormat.isHexDigit(id.charAt(i))) return false;
        }
        return true;
    }
}
