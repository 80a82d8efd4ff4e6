/*
 * Pathway - Technology Deployment Pathway Planner
 * Copyright (C) 2009, 2011-2017 Gordon Irlam
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.gordoni.pathway;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A minimization linear program over non-negative variables.
 *
 * Variables are identified by index in order of creation. Each row is a
 * sparse linear expression compared against a constant. This is the whole of
 * what is handed to a solver backend.
 */
public class LinearProgram
{
        public enum Relation
        {
                LEQ, GEQ, EQ
        }

        public static class Row
        {
                public final String family; // Constraint family, e.g. "vintage".
                public final String name;
                public final Relation relation;
                public final double rhs;

                private int[] index = new int[4];
                private double[] coef = new double[4];
                private int size = 0;

                Row(String family, String name, Relation relation, double rhs)
                {
                        this.family = family;
                        this.name = name;
                        this.relation = relation;
                        this.rhs = rhs;
                }

                /**
                 * Add coef * variable to the row. Repeated variables accumulate.
                 */
                public Row add(int var, double c)
                {
                        assert(var >= 0);
                        for (int k = 0; k < size; k++)
                                if (index[k] == var)
                                {
                                        coef[k] += c;
                                        return this;
                                }
                        if (size == index.length)
                        {
                                index = Arrays.copyOf(index, 2 * size);
                                coef = Arrays.copyOf(coef, 2 * size);
                        }
                        index[size] = var;
                        coef[size] = c;
                        size++;
                        return this;
                }

                public int size()
                {
                        return size;
                }

                public int index(int k)
                {
                        return index[k];
                }

                public double coef(int k)
                {
                        return coef[k];
                }

                public double[] dense(int num_variables)
                {
                        double[] res = new double[num_variables];
                        for (int k = 0; k < size; k++)
                                res[index[k]] += coef[k];
                        return res;
                }

                public double lhs(double[] x)
                {
                        double v = 0;
                        for (int k = 0; k < size; k++)
                                v += coef[k] * x[index[k]];
                        return v;
                }

                /**
                 * Amount by which x violates the row, zero if satisfied.
                 */
                public double violation(double[] x)
                {
                        double d = lhs(x) - rhs;
                        switch (relation)
                        {
                        case LEQ:
                                return Math.max(0, d);
                        case GEQ:
                                return Math.max(0, -d);
                        default:
                                return Math.abs(d);
                        }
                }

                public String toString()
                {
                        StringBuilder sb = new StringBuilder(name + ":");
                        for (int k = 0; k < size; k++)
                                sb.append(" " + (coef[k] < 0 ? "- " : "+ ") + Math.abs(coef[k]) + " x" + index[k]);
                        sb.append(relation == Relation.LEQ ? " <= " : relation == Relation.GEQ ? " >= " : " = ");
                        sb.append(rhs);
                        return sb.toString();
                }
        }

        private final List<String> names = new ArrayList<String>();
        private double[] objective = new double[16];
        private final List<Row> rows = new ArrayList<Row>();

        public int add_variable(String name)
        {
                names.add(name);
                if (names.size() > objective.length)
                        objective = Arrays.copyOf(objective, 2 * objective.length);
                return names.size() - 1;
        }

        public int num_variables()
        {
                return names.size();
        }

        public String variable_name(int var)
        {
                return names.get(var);
        }

        public Row add_row(String family, String name, Relation relation, double rhs)
        {
                Row row = new Row(family, name, relation, rhs);
                rows.add(row);
                return row;
        }

        public List<Row> rows()
        {
                return Collections.unmodifiableList(rows);
        }

        public void add_objective(int var, double c)
        {
                assert(var < names.size());
                objective[var] += c;
        }

        public double objective_coef(int var)
        {
                return objective[var];
        }

        public double[] objective()
        {
                return Arrays.copyOf(objective, names.size());
        }

        public double objective_value(double[] x)
        {
                double v = 0;
                for (int j = 0; j < names.size(); j++)
                        v += objective[j] * x[j];
                return v;
        }

        /**
         * Number of rows in each constraint family, in order of first appearance.
         */
        public Map<String, Integer> family_counts()
        {
                Map<String, Integer> res = new LinkedHashMap<String, Integer>();
                for (Row row : rows)
                {
                        Integer count = res.get(row.family);
                        res.put(row.family, count == null ? 1 : count + 1);
                }
                return res;
        }

        public List<Row> family(String family)
        {
                List<Row> res = new ArrayList<Row>();
                for (Row row : rows)
                        if (row.family.equals(family))
                                res.add(row);
                return res;
        }
}
