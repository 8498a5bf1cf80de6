package com.netmotif.dsl.ast;

import com.netmotif.dsl.SourcePosition;
import com.netmotif.motif.DegreeComparator;

/** {@code deg <op> value}, unvalidated. */
public record DegreeCriteriaLiteral(DegreeComparator comparator, int value, SourcePosition position) {
}
