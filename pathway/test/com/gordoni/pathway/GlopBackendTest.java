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
import static org.junit.jupiter.api.Assumptions.assumeTrue;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Skipped where the OR-Tools native libraries are not available.
 */
class GlopBackendTest
{
        @BeforeEach
        void requireNativeLibraries()
        {
                assumeTrue(GlopBackend.load());
        }

        @Test
        void solvesSmallProgram()
        {
                SolveControl control = new SolveControl(60);
                control.start();
                SolveOutcome outcome = new GlopBackend(new Config()).solve(SimplexBackendTest.small(), control);

                assertEquals(SolveStatus.OPTIMAL, outcome.status);
                assertEquals(1.75, outcome.objective, 1e-9);
        }

        @Test
        void agreesWithSimplex()
        {
                Config glop = Fixtures.config();
                glop.solvers = new ArrayList<String>(Arrays.asList("glop"));
                PathwayResult a = new PathwayPlanner(glop, Fixtures.coupled()).solve();
                PathwayResult b = new PathwayPlanner(Fixtures.config(), Fixtures.coupled()).solve();

                assertEquals(SolveStatus.OPTIMAL, a.status);
                assertEquals("glop", a.solver);
                assertEquals(b.objective, a.objective, 1e-6 * b.objective);
        }

        @Test
        void reportsInfeasible()
        {
                Config glop = Fixtures.config();
                glop.solvers = new ArrayList<String>(Arrays.asList("glop"));

                assertEquals(SolveStatus.INFEASIBLE, new PathwayPlanner(glop, Fixtures.reference(0.2, 1.0)).solve().status);
        }
}
