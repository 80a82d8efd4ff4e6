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

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Run configuration.
 *
 * Parameters are plain fields so that a scenario file or a sweep can override
 * any of them by name. A planner clones the configuration it is given, so a
 * configuration may be reused and modified between runs.
 */
public class Config implements Cloneable
{
        public String version = "java-1.0.0";

        public boolean trace = false; // Be chatty.
        public int workers = Runtime.getRuntime().availableProcessors(); // Number of worker threads to use for sensitivity sweeps.

        // Time horizon.

        public int start_year = 2025; // First model year.
        public int end_year = 2050; // Last model year, inclusive.
        public int[] years = null; // Explicit list of model years. Overrides start_year and end_year when not null.
        public Integer base_year = null; // Year to which costs are discounted. Null for the first model year.

        // Economics.

        public double discount_rate = 0.05; // Annual discount rate as a fraction.
        public String capital_charge = "install_year";
                // How annualized capital cost is charged. "install_year" to charge the capital recovery amount once, in the year of installation,
                // or "stream" to charge it in every model year the capacity is in service.

        // Target slack.

        public boolean slack = false; // Whether a shortfall against the required abatement is permitted.
        public Double slack_penalty = null; // Cost per unit of shortfall. Null to derive from the costliest technology.
        public double slack_penalty_factor = 10.0; // Multiple of the costliest unit abatement cost used for a derived slack penalty.

        // Technology defaults and policies.

        public double ramp_default = 0.2; // Maximum annual installation as a fraction of band activity when a technology omits its ramp rate.
        public String lifetime_window = "exclusive";
                // Vintage boundary. "exclusive" keeps an installation in service while its age is less than the lifetime,
                // "inclusive" while its age is at most the lifetime.
        public String extrapolation = "flat";
                // Time series values outside the known years. "flat" to hold the nearest known value, "linear" to extend the end segment,
                // or "none" to reject years outside the known range.

        // Solving.

        public List<String> solvers = new ArrayList<String>(Arrays.asList("glop", "simplex")); // Linear programming backends to try, in order.
        public double solver_timeout = 300.0; // Wall clock seconds allowed for solving.
        public int simplex_max_iterations = 1000000; // Pivot limit for the simplex backend.
        public double simplex_epsilon = 1e-6; // Simplex tableau comparison tolerance.
        public int simplex_max_ulps = 10; // Simplex floating point comparison ulps.
        public double simplex_cutoff = 1e-10; // Simplex tableau entries smaller than this are treated as zero.
        public String simplex_pivot_rule = "bland"; // "bland" to avoid cycling on degenerate problems, or "dantzig".

        public double tolerance = 1e-6; // Relative tolerance for post solve consistency checks and for reporting values as zero.

        public Config clone()
        {
                Config res = null;
                try
                {
                        res = (Config) super.clone();
                }
                catch (CloneNotSupportedException e)
                {
                        assert(false);
                }
                if (years != null)
                        res.years = years.clone();
                res.solvers = new ArrayList<String>(solvers);

                return res;
        }

        /**
         * Model years in ascending order.
         */
        public int[] model_years()
        {
                int[] res;
                if (years != null)
                {
                        res = years.clone();
                        Arrays.sort(res);
                        for (int i = 1; i < res.length; i++)
                                if (res[i] == res[i - 1])
                                        throw new IllegalArgumentException("Duplicate model year " + res[i]);
                }
                else
                {
                        if (end_year < start_year)
                                throw new IllegalArgumentException("end_year " + end_year + " precedes start_year " + start_year);
                        res = new int[end_year - start_year + 1];
                        for (int i = 0; i < res.length; i++)
                                res[i] = start_year + i;
                }
                if (res.length == 0)
                        throw new IllegalArgumentException("No model years");

                return res;
        }

        public int discount_base_year()
        {
                return base_year == null ? model_years()[0] : base_year;
        }

        public void validate()
        {
                model_years();
                if (!(discount_rate > -1) || Double.isInfinite(discount_rate))
                        throw new IllegalArgumentException("Invalid discount_rate " + discount_rate);
                if (!capital_charge.equals("stream") && !capital_charge.equals("install_year"))
                        throw new IllegalArgumentException("Unknown capital_charge " + capital_charge);
                if (slack_penalty != null && !(slack_penalty > 0))
                        throw new IllegalArgumentException("slack_penalty must be positive");
                if (!(slack_penalty_factor > 1))
                        throw new IllegalArgumentException("slack_penalty_factor must exceed 1");
                if (!(ramp_default >= 0))
                        throw new IllegalArgumentException("ramp_default must be non-negative");
                LifetimeWindow.parse(lifetime_window);
                Extrapolation.parse(extrapolation);
                if (solvers == null || solvers.isEmpty())
                        throw new IllegalArgumentException("No solvers specified");
                if (!(solver_timeout > 0))
                        throw new IllegalArgumentException("solver_timeout must be positive");
                if (!simplex_pivot_rule.equals("bland") && !simplex_pivot_rule.equals("dantzig"))
                        throw new IllegalArgumentException("Unknown simplex_pivot_rule " + simplex_pivot_rule);
                if (!(tolerance > 0))
                        throw new IllegalArgumentException("tolerance must be positive");
                if (workers < 1)
                        throw new IllegalArgumentException("workers must be at least 1");
        }

        /**
         * Return all the fields/values as a Map
         */
        private Map<String, Object> getAsMap()
        {
                Map<String, Object> params = new TreeMap<String, Object>();
                for (Field f : this.getClass().getDeclaredFields())
                {
                        if (Modifier.isStatic(f.getModifiers()))
                                continue;
                        try
                        {
                                params.put(f.getName(), f.get(this));
                        }
                        catch (IllegalAccessException e)
                        {
                                throw new IllegalStateException("Illegal access field " + f.getName(), e);
                        }
                }
                return params;
        }

        /**
         * Parse "name = value" lines into params. Text after a '#' is ignored.
         */
        public void load_params(Map<String, Object> params, String in)
        {
                String[] lines = in.split("\r?\n");
                for (String line : lines)
                {
                        int comment_pos = line.indexOf("#");
                        if (comment_pos != -1)
                                line = line.substring(0, comment_pos);
                        line = line.trim();
                        if (line.equals(""))
                                continue;
                        int eq_pos = line.indexOf("=");
                        if (eq_pos == -1)
                                throw new IllegalArgumentException("Expecting name = value: " + line);

                        String var = line.substring(0, eq_pos).trim();
                        String val = line.substring(eq_pos + 1).trim();
                        params.put(var, convertObjectFor(var, val));
                }
        }

        /**
         * Apply the parameters from the Map to the internal parameters
         */
        public void applyParams(Map<String, Object> params)
        {
                for (String field : params.keySet())
                {
                        try
                        {
                                Field f = this.getClass().getDeclaredField(field);
                                f.set(this, params.get(field));
                        }
                        catch (NoSuchFieldException e)
                        {
                                throw new IllegalArgumentException("Invalid field " + field);
                        }
                        catch (IllegalAccessException e)
                        {
                                throw new IllegalArgumentException("Illegal access field " + field);
                        }
                }
        }

        /**
         * Dump all the parameters to the output
         */
        public void dumpParams()
        {
                Map<String, Object> params = getAsMap();
                for (String key : params.keySet())
                {
                        Object param = params.get(key);
                        String sparam;
                        if (param instanceof int[])
                                sparam = Arrays.toString((int[]) param);
                        else if (param instanceof double[])
                                sparam = Arrays.toString((double[]) param);
                        else
                                sparam = String.valueOf(param);
                        System.out.println("   " + key + " = " + sparam);
                }
        }

        /**
         * Convert the string raw parameter to an object compatible with the specified field
         */
        private Object convertObjectFor(String field, String raw)
        {
                Field f;
                try
                {
                        f = this.getClass().getDeclaredField(field);
                }
                catch (NoSuchFieldException e)
                {
                        throw new IllegalArgumentException("No such field " + field);
                }
                try
                {
                        return convertObject(f.getType(), raw);
                }
                catch (RuntimeException e)
                {
                        throw new IllegalArgumentException("Value " + raw + " is not valid for the field " + field, e);
                }
        }

        /**
         * Convert the string raw parameter to an object of the specified class
         */
        private Object convertObject(Class<?> type, String raw)
        {
                raw = raw.trim();

                if ("none".equalsIgnoreCase(raw) || "null".equalsIgnoreCase(raw))
                {
                        if (type.isPrimitive())
                                throw new IllegalArgumentException("Null value for primitive");
                        return null;
                }

                if (type == String.class)
                {
                        if (raw.startsWith("\"") && raw.endsWith("\"") && raw.length() >= 2)
                                raw = raw.substring(1, raw.length() - 1);
                        else if (raw.startsWith("\'") && raw.endsWith("\'") && raw.length() >= 2)
                                raw = raw.substring(1, raw.length() - 1);
                        else
                                throw new IllegalArgumentException("Unquoted string value");
                        return raw;
                }
                else if (type == boolean.class)
                        return "true".equals(raw.toLowerCase()) || "1".equals(raw);
                else if (type == int.class || type == Integer.class)
                        return Integer.parseInt(raw);
                else if (type == double.class || type == Double.class)
                        return Double.parseDouble(raw);
                else if (type == List.class)
                {
                        List<String> data = new ArrayList<String>();
                        for (String s : split_list(raw))
                                data.add((String) convertObject(String.class, s));
                        return data;
                }
                else if (type == int[].class)
                {
                        String[] sa = split_list(raw);
                        int[] data = new int[sa.length];
                        for (int i = 0; i < sa.length; i++)
                                data[i] = (Integer) convertObject(int.class, sa[i]);
                        return data;
                }
                else if (type == double[].class)
                {
                        String[] sa = split_list(raw);
                        double[] data = new double[sa.length];
                        for (int i = 0; i < sa.length; i++)
                                data[i] = (Double) convertObject(double.class, sa[i]);
                        return data;
                }
                else
                        throw new IllegalArgumentException("Unsupported field type " + type.getSimpleName());
        }

        private static String[] split_list(String raw)
        {
                if (!raw.startsWith("[") || !raw.endsWith("]"))
                        throw new IllegalArgumentException("Expecting [...] list");
                String slist = raw.substring(1, raw.length() - 1);
                if (slist.trim().length() == 0)
                        return new String[0];
                return slist.split(",");
        }
}
