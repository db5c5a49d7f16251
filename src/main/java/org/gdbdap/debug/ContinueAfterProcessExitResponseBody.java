package org.gdbdap.debug;

import com.google.gson.annotations.SerializedName;

public class ContinueAfterProcessExitResponseBody {
    /** True when other inferiors are still attached and debugging goes on. */
    @SerializedName("continue")
    public boolean continueDebugging;
}
