package com.backlinkqc.collector;

import com.backlinkqc.order.Order;
import com.backlinkqc.preflight.PreflightMatrix;

/**
 * External drafting step: returns article text written against a matrix.
 */
public interface ArticleDraftSource {

    String draft(Order order, PreflightMatrix matrix);
}
