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

import java.util.Map;
import java.util.TreeMap;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;

/**
 * Dense annual series from a sparse year to value table.
 *
 * Between known years values are linearly interpolated. Outside the known
 * range the {@link Extrapolation} policy applies: FLAT holds the boundary
 * value, LINEAR continues the end segment, and NONE raises a
 * {@link DataGapException}. A single known year gives a constant series
 * except under NONE, where only that year resolves.
 */
public class TimeSeries
{
        private final String what;
        private final Extrapolation extrapolation;

        private final double[] xval;
        private final double[] fval;
        private PolynomialSplineFunction f = null;
        private UnivariateFunction s = null;

        public TimeSeries(String what, Map<Integer, Double> known, Extrapolation extrapolation)
        {
                this.what = what;
                this.extrapolation = extrapolation;

                TreeMap<Integer, Double> sorted = new TreeMap<Integer, Double>();
                if (known != null)
                        for (Map.Entry<Integer, Double> e : known.entrySet())
                                if (e.getKey() != null && e.getValue() != null && !Double.isNaN(e.getValue()))
                                        sorted.put(e.getKey(), e.getValue());
                if (sorted.isEmpty())
                        throw new DataGapException(what + ": no known values to resolve from");

                xval = new double[sorted.size()];
                fval = new double[sorted.size()];
                int i = 0;
                for (Map.Entry<Integer, Double> e : sorted.entrySet())
                {
                        xval[i] = e.getKey();
                        fval[i] = e.getValue();
                        i++;
                }

                if (xval.length > 1)
                {
                        LinearInterpolator interpolator = new LinearInterpolator();
                        this.f = interpolator.interpolate(xval, fval);
                        this.s = this.f.derivative();
                }
        }

        public double first_year()
        {
                return xval[0];
        }

        public double last_year()
        {
                return xval[xval.length - 1];
        }

        public double value(int year)
        {
                double xmin = xval[0];
                double xmax = xval[xval.length - 1];
                boolean in_range = xmin <= year && year <= xmax;

                if (!in_range && extrapolation == Extrapolation.NONE)
                        throw new DataGapException(what + ": year " + year + " is outside the known range " + (int) xmin + "-" + (int) xmax);

                if (f == null)
                        return fval[0];

                double x = Math.max(year, xmin);
                x = Math.min(x, xmax);
                double v = f.value(x);
                if (!in_range && extrapolation == Extrapolation.LINEAR)
                {
                        double slope = s.value(x);
                        v += (year - x) * slope;
                }

                return v;
        }

        public double[] resolve(int[] years)
        {
                double[] res = new double[years.length];
                for (int i = 0; i < years.length; i++)
                        res[i] = value(years[i]);
                return res;
        }

        public static double[] resolve(String what, Map<Integer, Double> known, int[] years, Extrapolation extrapolation)
        {
                return new TimeSeries(what, known, extrapolation).resolve(years);
        }
}
