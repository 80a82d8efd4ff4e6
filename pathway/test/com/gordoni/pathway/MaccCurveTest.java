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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

class MaccCurveTest
{
        @Test
        void ranksByLevelizedCost()
        {
                ModelInputs in = new ModelInputs(Fixtures.config(), Fixtures.exclusive_pair());
                List<MaccEntry> curve = new MaccCurve(in).entries(2025);

                assertEquals(2, curve.size());
                assertEquals("cheap", curve.get(0).tech_id);
                assertEquals("dear", curve.get(1).tech_id);
                double crf = ObjectiveBuilder.capital_recovery_factor(0.05, 30);
                assertEquals((crf * 50 + 10) / 0.5, curve.get(0).lcoa, 1e-9);
                assertEquals(50, curve.get(0).potential, 1e-9);
                assertEquals(100, curve.get(1).cumulative, 1e-9);
        }

        @Test
        void marginalCostOfAbatement()
        {
                ModelInputs in = new ModelInputs(Fixtures.config(), Fixtures.exclusive_pair());
                MaccCurve curve = new MaccCurve(in);
                List<MaccEntry> entries = curve.entries(2030);

                assertEquals(entries.get(0).lcoa, curve.marginal_cost(2030, 40), 0);
                assertEquals(entries.get(1).lcoa, curve.marginal_cost(2030, 60), 0);
                assertTrue(Double.isNaN(curve.marginal_cost(2030, 150)));
        }

        @Test
        void excludesTechnologiesNotYetAvailable()
        {
                Technology late = new Technology("late", "steel", 30, 2028, 1.0, 1.0, 0.5);
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5), late),
                        Arrays.asList(new CostRecord("h2", 100, 5, 5), new CostRecord("late", 10, 1, 1)), Arrays.asList(Fixtures.steel()),
                        Fixtures.ceiling(35), Collections.<TechLink>emptyList());
                MaccCurve curve = new MaccCurve(new ModelInputs(Fixtures.config(), data));

                assertEquals(1, curve.entries(2027).size());
                assertEquals("late", curve.entries(2028).get(0).tech_id);
        }

        @Test
        void rejectsYearsOutsideModel()
        {
                MaccCurve curve = new MaccCurve(new ModelInputs(Fixtures.config(), Fixtures.reference()));

                assertThrows(IllegalArgumentException.class, () -> curve.entries(2051));
        }
}
