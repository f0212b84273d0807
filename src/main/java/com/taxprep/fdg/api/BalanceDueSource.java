package com.taxprep.fdg.api;

/** Role of a root form that reports the amount owed with the return. */
public interface BalanceDueSource {

    /** Amount owed; the payment voucher is filed only when strictly positive. */
    double balanceDue();
}
