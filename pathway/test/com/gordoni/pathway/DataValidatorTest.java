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

class DataValidatorTest
{
        private static List<String> errors(PlanningData data)
        {
                DataValidationException e = assertThrows(DataValidationException.class, () -> DataValidator.validate(data));
                return e.errors();
        }

        private static boolean mentions(List<String> errors, String text)
        {
                for (String e : errors)
                        if (e.contains(text))
                                return true;
                return false;
        }

        @Test
        void acceptsFixtures()
        {
                DataValidator.validate(Fixtures.reference());
                DataValidator.validate(Fixtures.exclusive_pair());
                DataValidator.validate(Fixtures.coupled());
        }

        @Test
        void collectsEveryProblem()
        {
                Technology bad = new Technology("h2", "steel", 0, null, -1.0, 1.5, 0.9);
                PlanningData data = Fixtures.data(Arrays.asList(bad), Arrays.asList(new CostRecord("h2", -5, 1, 1)),
                        Arrays.asList(Fixtures.steel()), Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                List<String> errors = errors(data);
                assertTrue(mentions(errors, "lifetime must be at least 1"));
                assertTrue(mentions(errors, "missing commercial_year"));
                assertTrue(mentions(errors, "ramp_rate must be non-negative"));
                assertTrue(mentions(errors, "adoption_cap 1.5"));
                assertTrue(mentions(errors, "exceeds the emission intensity"));
                assertTrue(mentions(errors, "capex in 0 must be non-negative"));
                assertEquals(6, errors.size());
        }

        @Test
        void everyTechnologyNeedsACostRecord()
        {
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5)), Collections.<CostRecord>emptyList(),
                        Arrays.asList(Fixtures.steel()), Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                assertTrue(mentions(errors(data), "Technology h2: missing cost record"));
        }

        @Test
        void duplicateIdsAreRejected()
        {
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5), Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5)),
                        Arrays.asList(new CostRecord("h2", 100, 5, 5)), Arrays.asList(Fixtures.steel(), Fixtures.steel()), Fixtures.ceiling(35),
                        Collections.<TechLink>emptyList());

                List<String> errors = errors(data);
                assertTrue(mentions(errors, "BaselineBand steel: duplicate id"));
                assertTrue(mentions(errors, "Technology h2: duplicate id"));
        }

        @Test
        void bandsNeedPositiveActivity()
        {
                PlanningData data = Fixtures.data(Collections.<Technology>emptyList(), Collections.<CostRecord>emptyList(),
                        Arrays.asList(new BaselineBand("steel", 0, 0.5)), Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                assertTrue(mentions(errors(data), "activity must be positive"));
        }

        @Test
        void linksMustNameKnownTechnologies()
        {
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5)), Arrays.asList(new CostRecord("h2", 100, 5, 5)),
                        Arrays.asList(Fixtures.steel()), Fixtures.ceiling(35),
                        Arrays.asList(TechLink.exclusive("h2", "ccs"), TechLink.exclusive("h2"), TechLink.coupling("h2", "h2")));

                List<String> errors = errors(data);
                assertTrue(mentions(errors, "unknown technology ccs"));
                assertTrue(mentions(errors, "needs at least two technologies"));
                assertTrue(mentions(errors, "repeated technology"));
        }

        @Test
        void targetsAreRequired()
        {
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 1.0, 1.0, 0.5)), Arrays.asList(new CostRecord("h2", 100, 5, 5)),
                        Arrays.asList(Fixtures.steel()), new TargetSchedule(Collections.<Integer, Double>emptyMap()), Collections.<TechLink>emptyList());

                assertTrue(mentions(errors(data), "no targets"));
        }

        @Test
        void resolvedValuesOutsideRangeAreRejected()
        {
                Config config = Fixtures.config();
                config.extrapolation = "linear";
                Technology rising = new Technology("h2", "steel", 30, 2025, 1.0, Fixtures.series(2025, 0.5, 2026, 0.9), Fixtures.series(2025, 0.5));
                PlanningData data = Fixtures.data(Arrays.asList(rising), Arrays.asList(new CostRecord("h2", 100, 5, 5)), Arrays.asList(Fixtures.steel()),
                        Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                DataValidationException e = assertThrows(DataValidationException.class, () -> new ModelInputs(config, data));
                assertTrue(mentions(e.errors(), "resolved adoption_cap"));
        }
}
