package com.relengine.query.processor;

import com.relengine.query.domain.Table;

/**
 * An aggregate computed over the rows of one group.
 */
@FunctionalInterface
public interface AggregateFunction {

    double apply(Table group);
}
