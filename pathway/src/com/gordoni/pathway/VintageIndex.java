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

import java.util.Arrays;

/**
 * Precomputed vintage windows.
 *
 * alive(i, t) lists the indices of the model years whose installations of
 * technology i are still in service in model year t, and serves(i, tau) the
 * model years an installation made in year tau is in service. Ages are
 * measured in calendar years, so a sparse list of model years is handled
 * correctly: only modeled installation years can contribute.
 */
public class VintageIndex
{
        private final int[][][] alive;
        private final int[][][] serves;

        public VintageIndex(int[] years, int[] lifetime, LifetimeWindow window)
        {
                alive = new int[lifetime.length][years.length][];
                serves = new int[lifetime.length][years.length][];
                for (int i = 0; i < lifetime.length; i++)
                {
                        for (int t = 0; t < years.length; t++)
                                alive[i][t] = window_of(years, t, lifetime[i], window);
                        int[] count = new int[years.length];
                        for (int t = 0; t < years.length; t++)
                                for (int tau : alive[i][t])
                                        count[tau]++;
                        for (int tau = 0; tau < years.length; tau++)
                                serves[i][tau] = new int[count[tau]];
                        Arrays.fill(count, 0);
                        for (int t = 0; t < years.length; t++)
                                for (int tau : alive[i][t])
                                        serves[i][tau][count[tau]++] = t;
                }
        }

        public VintageIndex(ModelInputs in)
        {
                this(in.years, in.lifetime, in.window);
        }

        private static int[] window_of(int[] years, int t, int lifetime, LifetimeWindow window)
        {
                int count = 0;
                for (int tau = 0; tau <= t; tau++)
                        if (window.in_service(years[t] - years[tau], lifetime))
                                count++;
                int[] res = new int[count];
                int k = 0;
                for (int tau = 0; tau <= t; tau++)
                        if (window.in_service(years[t] - years[tau], lifetime))
                                res[k++] = tau;
                return res;
        }

        public int[] alive(int i, int t)
        {
                return alive[i][t];
        }

        public int[] serves(int i, int tau)
        {
                return serves[i][tau];
        }

        /**
         * In-service capacity of technology i in every model year given its installation series.
         */
        public double[] in_service(int i, double[] installs)
        {
                assert(installs.length == alive[i].length);
                double[] res = new double[installs.length];
                for (int t = 0; t < installs.length; t++)
                        for (int tau : alive[i][t])
                                res[t] += installs[tau];
                return res;
        }

        /**
         * In-service capacity in each year computed directly from installation years and ages.
         */
        public static double[] in_service(int[] years, double[] installs, int lifetime, LifetimeWindow window)
        {
                double[] res = new double[years.length];
                for (int t = 0; t < years.length; t++)
                        for (int tau = 0; tau < years.length; tau++)
                                if (window.in_service(years[t] - years[tau], lifetime))
                                        res[t] += installs[tau];
                return res;
        }
}
