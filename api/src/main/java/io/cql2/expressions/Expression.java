/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.cql2.expressions;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import java.io.Serializable;
import java.util.Locale;
import java.util.Map;

/** Represents a node in a CQL2 filter expression tree. */
public interface Expression extends Serializable {
  enum Operation {
    PROPERTY("property", null),
    LITERAL("literal", null),
    EQ("=", "="),
    NOT_EQ("<>", "<>"),
    LT("<", "<"),
    LT_EQ("<=", "<="),
    GT(">", ">"),
    GT_EQ(">=", ">="),
    AND("and", "AND"),
    OR("or", "OR"),
    NOT("not", "NOT"),
    BETWEEN("between", "BETWEEN"),
    LIKE("like", "LIKE"),
    IN("in", "IN"),
    IS_NULL("isNull", "IS NULL"),
    S_INTERSECTS("s_intersects", "S_INTERSECTS"),
    S_CONTAINS("s_contains", "S_CONTAINS"),
    S_WITHIN("s_within", "S_WITHIN"),
    S_EQUALS("s_equals", "S_EQUALS"),
    S_DISJOINT("s_disjoint", "S_DISJOINT"),
    S_TOUCHES("s_touches", "S_TOUCHES"),
    S_OVERLAPS("s_overlaps", "S_OVERLAPS"),
    S_CROSSES("s_crosses", "S_CROSSES"),
    T_AFTER("t_after", "T_AFTER"),
    T_BEFORE("t_before", "T_BEFORE"),
    T_DURING("t_during", "T_DURING"),
    T_CONTAINS("t_contains", "T_CONTAINS"),
    T_DISJOINT("t_disjoint", "T_DISJOINT"),
    T_EQUALS("t_equals", "T_EQUALS"),
    T_MEETS("t_meets", "T_MEETS"),
    T_MET_BY("t_metBy", "T_METBY"),
    T_OVERLAPS("t_overlaps", "T_OVERLAPS"),
    T_OVERLAPPED_BY("t_overlappedBy", "T_OVERLAPPEDBY"),
    T_STARTED_BY("t_startedBy", "T_STARTEDBY"),
    T_STARTS("t_starts", "T_STARTS"),
    T_FINISHED_BY("t_finishedBy", "T_FINISHEDBY"),
    T_FINISHES("t_finishes", "T_FINISHES"),
    T_INTERSECTS("t_intersects", "T_INTERSECTS"),
    FUNCTION("function", null);

    private static final Map<String, Operation> BY_JSON_NAME;
    private static final Map<String, Operation> BY_TEXT_NAME;

    static {
      ImmutableMap.Builder<String, Operation> byJson = ImmutableMap.builder();
      ImmutableMap.Builder<String, Operation> byText = ImmutableMap.builder();
      for (Operation op : values()) {
        if (op.textName != null) {
          byJson.put(op.jsonName, op);
          byText.put(op.textName, op);
        }
      }
      BY_JSON_NAME = byJson.build();
      BY_TEXT_NAME = byText.build();
    }

    private final String jsonName;
    private final String textName;

    Operation(String jsonName, String textName) {
      this.jsonName = jsonName;
      this.textName = textName;
    }

    /** Returns the case-sensitive operator name used by CQL2-JSON. */
    public String jsonName() {
      return jsonName;
    }

    /** Returns the operator keyword used by CQL2-Text, or null for operand nodes. */
    public String textName() {
      return textName;
    }

    /**
     * Looks up an operation by its CQL2-JSON operator name.
     *
     * <p>The lookup is case-sensitive. Operand kinds ({@link #PROPERTY}, {@link #LITERAL}) and
     * {@link #FUNCTION} are never returned.
     *
     * @param name an operator name, such as "s_intersects"
     * @return the operation, or null if the name is not a fixed operator
     */
    public static Operation fromJsonName(String name) {
      Preconditions.checkArgument(null != name, "Invalid operator name: null");
      return BY_JSON_NAME.get(name);
    }

    /**
     * Looks up a spatial or temporal operation by its CQL2-Text name, ignoring case.
     *
     * @param name an operator name, such as "T_INTERSECTS"
     * @return the operation, or null if the name is not a spatial or temporal operator
     */
    public static Operation fromTextName(String name) {
      Preconditions.checkArgument(null != name, "Invalid operator name: null");
      Operation op = BY_TEXT_NAME.get(name.toUpperCase(Locale.ROOT));
      if (op != null && (op.isSpatial() || op.isTemporal())) {
        return op;
      }

      return null;
    }

    public boolean isComparison() {
      switch (this) {
        case EQ:
        case NOT_EQ:
        case LT:
        case LT_EQ:
        case GT:
        case GT_EQ:
          return true;
        default:
          return false;
      }
    }

    public boolean isLogical() {
      return this == AND || this == OR;
    }

    public boolean isSpatial() {
      return name().startsWith("S_");
    }

    public boolean isTemporal() {
      return name().startsWith("T_");
    }

    /** Returns whether this operation is a terminal (leaf-level) predicate. */
    public boolean isPredicate() {
      switch (this) {
        case BETWEEN:
        case LIKE:
        case IN:
        case IS_NULL:
          return true;
        default:
          return isComparison() || isSpatial() || isTemporal();
      }
    }

    /**
     * Returns the number of arguments this operation takes, or -1 when the count is variable.
     *
     * <p>Logical operations take one or more arguments.
     */
    public int arity() {
      switch (this) {
        case PROPERTY:
        case LITERAL:
          return 0;
        case NOT:
        case IS_NULL:
          return 1;
        case BETWEEN:
          return 3;
        case AND:
        case OR:
        case FUNCTION:
          return -1;
        default:
          return 2;
      }
    }
  }

  /** Returns the operation for an expression node. */
  Operation op();
}
