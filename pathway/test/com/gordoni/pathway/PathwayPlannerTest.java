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
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PathwayPlannerTest
{
        private static final double EPS = 1e-6;

        @Test
        @DisplayName("A 50 unit baseline with a 35 unit ceiling is met with exactly 30 units of production")
        void meetsReferenceTarget()
        {
                PathwayResult result = new PathwayPlanner(Fixtures.config(), Fixtures.reference()).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                assertEquals("simplex", result.solver);
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                {
                        TechYearResult r = result.record("h2", year);
                        assertEquals(30, r.production, EPS);
                        assertEquals(15, r.abatement, EPS);
                        assertEquals(30, r.in_service, EPS);
                        assertEquals(0.3, r.share, EPS);

                        YearSummary y = result.year(year);
                        assertEquals(15, y.required, EPS);
                        assertEquals(15, y.achieved, EPS);
                        assertEquals(0, y.shortfall, EPS);
                        assertEquals(35, y.remaining_emissions, EPS);
                        assertEquals(70, y.residual_activity(0), EPS);
                        assertTrue(y.target_met(1e-6));
                }
                assertEquals(30, result.record("h2", Fixtures.START).installed, EPS);
                assertEquals(0, result.record("h2", Fixtures.START + 1).installed, EPS);
                assertEquals(0, result.total_shortfall(), EPS);
        }

        @Test
        void objectiveMatchesReportedCosts()
        {
                PathwayResult result = new PathwayPlanner(Fixtures.config(), Fixtures.reference()).solve();

                CostMetrics metrics = result.cost_metrics();
                assertEquals(result.objective, metrics.discounted_cost, 1e-6 * result.objective);
                assertEquals(0, metrics.penalty_cost, 1e-6 * result.objective);
                assertEquals(15 * 6, metrics.total_abatement, EPS);
                assertEquals(metrics.undiscounted_cost / metrics.total_abatement, metrics.cost_per_abatement, EPS);
        }

        @Test
        @DisplayName("Of two mutually exclusive technologies the cheaper one is chosen")
        void exclusivityPicksCheaper()
        {
                PathwayPlanner planner = new PathwayPlanner(Fixtures.config(), Fixtures.exclusive_pair());
                PathwayResult result = planner.solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                {
                        TechYearResult cheap = result.record("cheap", year);
                        TechYearResult dear = result.record("dear", year);
                        assertEquals(30, cheap.production, EPS);
                        assertEquals(0, dear.production, EPS);
                        assertTrue(cheap.share + dear.share <= 1 + EPS);
                }
        }

        @Test
        void couplingHoldsEveryYear()
        {
                PathwayResult result = new PathwayPlanner(Fixtures.config(), Fixtures.coupled()).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                boolean used = false;
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                {
                        TechYearResult h2 = result.record("h2", year);
                        TechYearResult power = result.record("clean_power", year);
                        assertTrue(power.share >= h2.share - EPS, "coupling violated in " + year);
                        used |= h2.production > 0;
                }
                assertTrue(used);
        }

        @Test
        @DisplayName("An unreachable target without slack is infeasible and the short years are diagnosed")
        void infeasibleWithoutSlack()
        {
                PathwayPlanner planner = new PathwayPlanner(Fixtures.config(), Fixtures.reference(0.2, 1.0));
                PathwayResult result = planner.solve();

                assertEquals(SolveStatus.INFEASIBLE, result.status);
                assertEquals(RunState.INFEASIBLE, planner.state());
                assertTrue(result.records.isEmpty());
                assertEquals(Arrays.asList(2025, 2026, 2027, 2028, 2029, 2030), result.infeasible_years);
        }

        @Test
        void slackReportsShortfall()
        {
                Config config = Fixtures.config();
                config.slack = true;
                PathwayResult result = new PathwayPlanner(config, Fixtures.reference(0.2, 1.0)).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                {
                        assertEquals(20, result.record("h2", year).production, EPS);
                        assertEquals(5, result.shortfall(year), EPS);
                        assertFalse(result.year(year).target_met(1e-6));
                }
                assertEquals(30, result.total_shortfall(), EPS);
                assertTrue(result.cost_metrics().penalty_cost > 0);
        }

        @Test
        void nothingIsInstalledBeforeCommercialization()
        {
                Technology late = new Technology("h2", "steel", 30, 2027, 1.0, 1.0, 0.5);
                TargetSchedule targets = new TargetSchedule(Fixtures.series(2025, 50, 2027, 50, 2028, 35));
                PlanningData data = Fixtures.data(Arrays.asList(late), Arrays.asList(new CostRecord("h2", 100, 5, 5)), Arrays.asList(Fixtures.steel()), targets,
                        Collections.<TechLink>emptyList());

                PathwayResult result = new PathwayPlanner(Fixtures.config(), data).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                assertEquals(0, result.record("h2", 2025).installed, EPS);
                assertEquals(0, result.record("h2", 2026).installed, EPS);
                assertEquals(30, result.record("h2", 2028).production, EPS);
                assertEquals(0, result.year(2026).required, EPS);
        }

        @Test
        @DisplayName("A falling adoption cap limits in service capacity in every year")
        void fallingCapIsRespected()
        {
                Technology falling = new Technology("h2", "steel", 30, Fixtures.START, 1.0, Fixtures.series(2025, 0.5, 2026, 0.3), Fixtures.series(2025, 0.5));
                PlanningData data = Fixtures.data(Arrays.asList(falling), Arrays.asList(new CostRecord("h2", 100, 5, 5)), Arrays.asList(Fixtures.steel()),
                        Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                PathwayResult result = new PathwayPlanner(Fixtures.config(), data).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                {
                        TechYearResult r = result.record("h2", year);
                        assertTrue(r.in_service <= 30 + EPS, "capacity above cap in " + year);
                        assertEquals(30, r.production, EPS);
                }
        }

        @Test
        @DisplayName("A binding ramp spreads installation over the years before the target")
        void rampLimitsAnnualInstallation()
        {
                TargetSchedule targets = new TargetSchedule(Fixtures.series(2025, 50, 2029, 50, 2030, 35));
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "steel", 0.1, 1.0, 0.5)), Arrays.asList(new CostRecord("h2", 100, 5, 5)),
                        Arrays.asList(Fixtures.steel()), targets, Collections.<TechLink>emptyList());

                PathwayResult result = new PathwayPlanner(Fixtures.config(), data).solve();

                assertEquals(SolveStatus.OPTIMAL, result.status);
                for (int year = Fixtures.START; year <= Fixtures.END; year++)
                        assertTrue(result.record("h2", year).installed <= 10 + EPS, "ramp exceeded in " + year);
                assertEquals(0, result.record("h2", 2027).in_service, EPS);
                assertEquals(10, result.record("h2", 2028).in_service, EPS);
                assertEquals(20, result.record("h2", 2029).in_service, EPS);
                assertEquals(30, result.record("h2", 2030).in_service, EPS);
                assertEquals(30, result.record("h2", 2030).production, EPS);
        }

        @Test
        @DisplayName("Solving the same inputs twice gives the same pathway")
        void resolveIsIdempotent()
        {
                PathwayResult a = new PathwayPlanner(Fixtures.config(), Fixtures.exclusive_pair()).solve();
                PathwayResult b = new PathwayPlanner(Fixtures.config(), Fixtures.exclusive_pair()).solve();

                assertEquals(a.objective, b.objective, 1e-9 * Math.abs(a.objective));
                assertEquals(a.records.size(), b.records.size());
                for (int k = 0; k < a.records.size(); k++)
                {
                        assertEquals(a.records.get(k).installed, b.records.get(k).installed, EPS);
                        assertEquals(a.records.get(k).production, b.records.get(k).production, EPS);
                }
        }

        @Test
        void solvesOnlyOnce()
        {
                PathwayPlanner planner = new PathwayPlanner(Fixtures.config(), Fixtures.reference());
                assertEquals(RunState.BUILT, planner.state());

                planner.solve();
                assertEquals(RunState.OPTIMAL, planner.state());
                assertTrue(planner.state().terminal());
                assertThrows(IllegalStateException.class, () -> planner.solve());
        }

        @Test
        void cancelledBeforeSolve()
        {
                PathwayPlanner planner = new PathwayPlanner(Fixtures.config(), Fixtures.reference());
                planner.cancel();
                PathwayResult result = planner.solve();

                assertEquals(SolveStatus.CANCELLED, result.status);
                assertEquals(RunState.CANCELLED, planner.state());
                assertTrue(Double.isNaN(result.objective));
        }

        @Test
        void unknownSolverIsUnavailable()
        {
                Config config = Fixtures.config();
                config.solvers = Arrays.asList("cplex");
                PathwayPlanner planner = new PathwayPlanner(config, Fixtures.reference());
                PathwayResult result = planner.solve();

                assertEquals(SolveStatus.SOLVER_UNAVAILABLE, result.status);
                assertEquals(RunState.SOLVER_UNAVAILABLE, planner.state());
                assertTrue(result.message.contains("cplex"));
        }

        @Test
        void plannerWorksOnItsOwnConfig()
        {
                Config config = Fixtures.config();
                PathwayPlanner planner = new PathwayPlanner(config, Fixtures.reference());
                config.discount_rate = 0.5;

                assertEquals(0.05, planner.config().discount_rate, 0);
                assertNotNull(planner.program().family_counts().get(ConstraintAssembler.VINTAGE));
        }

        @Test
        void invalidDataIsRejectedAtConstruction()
        {
                PlanningData data = Fixtures.data(Arrays.asList(Fixtures.tech("h2", "cement", 1.0, 1.0, 0.5)), Arrays.asList(new CostRecord("h2", 100, 5, 5)),
                        Arrays.asList(Fixtures.steel()), Fixtures.ceiling(35), Collections.<TechLink>emptyList());

                DataValidationException e = assertThrows(DataValidationException.class, () -> new PathwayPlanner(Fixtures.config(), data));
                assertTrue(e.errors().get(0).contains("unknown band cement"));
        }
}
