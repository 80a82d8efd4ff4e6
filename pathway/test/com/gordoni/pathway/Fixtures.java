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
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Small planning data sets shared by the tests.
 *
 * The reference case is a single band with activity 100 and emission
 * intensity 0.5, so baseline emissions are 50. A ceiling of 35 requires 15
 * units of abatement, which a technology abating 0.5 per unit meets with 30
 * units of production.
 */
class Fixtures
{
        static final int START = 2025;
        static final int END = 2030;

        static Config config()
        {
                Config config = new Config();
                config.start_year = START;
                config.end_year = END;
                config.solvers = new ArrayList<String>(Arrays.asList("simplex"));
                config.solver_timeout = 60;
                config.workers = 2;
                return config;
        }

        static Map<Integer, Double> series(Object... year_value)
        {
                Map<Integer, Double> res = new TreeMap<Integer, Double>();
                for (int k = 0; k < year_value.length; k += 2)
                        res.put((Integer) year_value[k], ((Number) year_value[k + 1]).doubleValue());
                return res;
        }

        static BaselineBand steel()
        {
                return new BaselineBand("steel", 100, 0.5);
        }

        static Technology tech(String id, String band, double ramp, double cap, double factor)
        {
                return new Technology(id, band, 30, START, ramp, cap, factor);
        }

        static TargetSchedule ceiling(double ceiling)
        {
                return new TargetSchedule(series(START, ceiling));
        }

        static PlanningData data(List<Technology> techs, List<CostRecord> costs, List<BaselineBand> bands, TargetSchedule targets, List<TechLink> links)
        {
                return new PlanningData(techs, costs, bands, targets, links);
        }

        /**
         * One hydrogen technology able to take over the whole band.
         */
        static PlanningData reference(double cap, double ramp)
        {
                return data(Arrays.asList(tech("h2", "steel", ramp, cap, 0.5)),
                        Arrays.asList(new CostRecord("h2", 100, 5, 5)),
                        Arrays.asList(steel()),
                        ceiling(35),
                        Collections.<TechLink>emptyList());
        }

        static PlanningData reference()
        {
                return reference(1.0, 1.0);
        }

        /**
         * Two technologies in the same band, "cheap" costing less than "dear", that may not be combined.
         */
        static PlanningData exclusive_pair()
        {
                return data(Arrays.asList(tech("cheap", "steel", 1.0, 1.0, 0.5), tech("dear", "steel", 1.0, 1.0, 0.5)),
                        Arrays.asList(new CostRecord("cheap", 50, 5, 5), new CostRecord("dear", 100, 5, 5)),
                        Arrays.asList(steel()),
                        ceiling(35),
                        Arrays.asList(TechLink.exclusive("cheap", "dear")));
        }

        /**
         * Steel hydrogen requires a share of clean power at least its own share.
         */
        static PlanningData coupled()
        {
                return data(Arrays.asList(tech("h2", "steel", 1.0, 1.0, 0.5), tech("clean_power", "power", 1.0, 1.0, 0.1)),
                        Arrays.asList(new CostRecord("h2", 100, 5, 5), new CostRecord("clean_power", 200, 10, 10)),
                        Arrays.asList(steel(), new BaselineBand("power", 100, 0.1)),
                        ceiling(45),
                        Arrays.asList(TechLink.coupling("h2", "clean_power")));
        }
}
