package com.mailexchange.history;

import com.google.gson.annotations.SerializedName;

/**
 * Aggregate status of a forward.
 */
public enum ForwardStatus {

    /**
     * Every recipient was delivered.
     */
    @SerializedName("success")
    SUCCESS,

    /**
     * At least one recipient failed after all attempts.
     */
    @SerializedName("failed")
    FAILED
}
