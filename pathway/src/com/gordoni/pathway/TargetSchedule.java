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

/**
 * Absolute emission ceilings for a subset of years.
 */
public class TargetSchedule
{
        public final Map<Integer, Double> ceiling;

        public TargetSchedule(Map<Integer, Double> ceiling)
        {
                this.ceiling = Technology.freeze(ceiling);
        }

        public double[] resolve(int[] years, Extrapolation extrapolation)
        {
                return TimeSeries.resolve("emission target", ceiling, years, extrapolation);
        }

        /**
         * Required abatement max(0, baseline - target) for each year.
         */
        public static double[] required_abatement(double baseline, double[] target)
        {
                double[] res = new double[target.length];
                for (int i = 0; i < target.length; i++)
                        res[i] = Math.max(0.0, baseline - target[i]);
                return res;
        }
}
