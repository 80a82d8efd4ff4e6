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

/**
 * Decision variable indices for each technology and year.
 */
public class VariableLayout
{
        public static final int NONE = -1;

        private final int[][] install;
        private final int[][] capacity;
        private final int[][] production;
        private final int[][] abatement;
        private final int[] shortfall;

        public VariableLayout(ModelInputs in, LinearProgram lp, boolean slack)
        {
                int n = in.num_techs();
                int y = in.num_years();
                install = new int[n][y];
                capacity = new int[n][y];
                production = new int[n][y];
                abatement = new int[n][y];
                shortfall = new int[y];

                for (int i = 0; i < n; i++)
                {
                        String id = in.techs.get(i).id;
                        for (int t = 0; t < y; t++)
                        {
                                String at = "[" + id + "," + in.years[t] + "]";
                                install[i][t] = lp.add_variable("install" + at);
                                capacity[i][t] = lp.add_variable("capacity" + at);
                                production[i][t] = lp.add_variable("production" + at);
                                abatement[i][t] = lp.add_variable("abatement" + at);
                        }
                }
                for (int t = 0; t < y; t++)
                        shortfall[t] = slack ? lp.add_variable("shortfall[" + in.years[t] + "]") : NONE;
        }

        public int install(int i, int t)
        {
                return install[i][t];
        }

        public int capacity(int i, int t)
        {
                return capacity[i][t];
        }

        public int production(int i, int t)
        {
                return production[i][t];
        }

        public int abatement(int i, int t)
        {
                return abatement[i][t];
        }

        /**
         * Shortfall variable for year t, or NONE when slack is disabled.
         */
        public int shortfall(int t)
        {
                return shortfall[t];
        }

        public boolean has_slack()
        {
                return shortfall.length > 0 && shortfall[0] != NONE;
        }
}
