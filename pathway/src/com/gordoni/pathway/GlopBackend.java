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

import com.google.ortools.Loader;
import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPVariable;

/**
 * Google OR-Tools GLOP backend.
 *
 * Unavailable when the OR-Tools native libraries can not be loaded on this
 * platform. Cancellation is forwarded to MPSolver.interruptSolve(), which
 * GLOP honors on a best effort basis.
 */
class GlopBackend extends LpBackend
{
        private static Boolean loaded = null;

        private final Config config;

        public GlopBackend(Config config)
        {
                this.config = config;
        }

        String name()
        {
                return "glop";
        }

        synchronized static boolean load()
        {
                if (loaded == null)
                {
                        try
                        {
                                Loader.loadNativeLibraries();
                                loaded = true;
                        }
                        catch (RuntimeException | LinkageError e)
                        {
                                loaded = false;
                        }
                }
                return loaded;
        }

        boolean available()
        {
                return load();
        }

        SolveOutcome solve(LinearProgram lp, SolveControl control)
        {
                if (!available())
                        return SolveOutcome.of(SolveStatus.SOLVER_UNAVAILABLE, name(), "OR-Tools native libraries not loadable");

                final MPSolver solver = MPSolver.createSolver("GLOP");
                if (solver == null)
                        return SolveOutcome.of(SolveStatus.SOLVER_UNAVAILABLE, name(), "GLOP not linked into OR-Tools");
                try
                {
                        double inf = MPSolver.infinity();
                        int n = lp.num_variables();
                        MPVariable[] x = new MPVariable[n];
                        for (int j = 0; j < n; j++)
                                x[j] = solver.makeNumVar(0.0, inf, lp.variable_name(j));

                        for (LinearProgram.Row row : lp.rows())
                        {
                                double lb = (row.relation == LinearProgram.Relation.LEQ ? -inf : row.rhs);
                                double ub = (row.relation == LinearProgram.Relation.GEQ ? inf : row.rhs);
                                MPConstraint c = solver.makeConstraint(lb, ub, row.name);
                                for (int k = 0; k < row.size(); k++)
                                        c.setCoefficient(x[row.index(k)], row.coef(k));
                        }

                        MPObjective objective = solver.objective();
                        double[] coef = lp.objective();
                        for (int j = 0; j < n; j++)
                                if (coef[j] != 0)
                                        objective.setCoefficient(x[j], coef[j]);
                        objective.setMinimization();

                        long remaining = control.remaining_millis();
                        if (remaining != Long.MAX_VALUE)
                                solver.setTimeLimit(Math.max(1, remaining));

                        control.set_interrupter(new Runnable()
                        {
                                public void run()
                                {
                                        solver.interruptSolve();
                                }
                        });
                        MPSolver.ResultStatus status;
                        try
                        {
                                status = solver.solve();
                        }
                        finally
                        {
                                control.set_interrupter(null);
                        }

                        if (control.cancelled() && status != MPSolver.ResultStatus.OPTIMAL)
                                return SolveOutcome.of(SolveStatus.CANCELLED, name(), "cancelled");
                        switch (status)
                        {
                        case OPTIMAL:
                                double[] values = new double[n];
                                for (int j = 0; j < n; j++)
                                        values[j] = x[j].solutionValue();
                                return SolveOutcome.optimal(name(), values, objective.value());
                        case INFEASIBLE:
                                return SolveOutcome.of(SolveStatus.INFEASIBLE, name(), "no feasible solution");
                        case UNBOUNDED:
                                return SolveOutcome.of(SolveStatus.UNBOUNDED, name(), "unbounded solution");
                        default:
                                if (control.expired())
                                        return SolveOutcome.of(SolveStatus.TIMED_OUT, name(), "time limit reached with status " + status);
                                return SolveOutcome.of(SolveStatus.SOLVER_UNAVAILABLE, name(), "GLOP returned " + status);
                        }
                }
                finally
                {
                        solver.delete();
                }
        }
}
