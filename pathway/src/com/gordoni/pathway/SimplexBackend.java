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
import java.util.List;

import org.apache.commons.math3.exception.TooManyIterationsException;
import org.apache.commons.math3.optim.MaxIter;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.linear.LinearConstraint;
import org.apache.commons.math3.optim.linear.LinearConstraintSet;
import org.apache.commons.math3.optim.linear.LinearObjectiveFunction;
import org.apache.commons.math3.optim.linear.NoFeasibleSolutionException;
import org.apache.commons.math3.optim.linear.NonNegativeConstraint;
import org.apache.commons.math3.optim.linear.PivotSelectionRule;
import org.apache.commons.math3.optim.linear.Relationship;
import org.apache.commons.math3.optim.linear.SimplexSolver;
import org.apache.commons.math3.optim.linear.UnboundedSolutionException;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;

/**
 * Pure Java backend using the Apache Commons Math dense tableau simplex.
 *
 * Always available. The time limit and cancellation are checked at every
 * pivot.
 */
class SimplexBackend extends LpBackend
{
        private final Config config;

        private static class Interrupted extends RuntimeException
        {
                private static final long serialVersionUID = 1L;

                final SolveStatus status;

                Interrupted(SolveStatus status)
                {
                        super(status.toString(), null, false, false);
                        this.status = status;
                }
        }

        private static class ControlledSimplexSolver extends SimplexSolver
        {
                private final SolveControl control;

                ControlledSimplexSolver(Config config, SolveControl control)
                {
                        super(config.simplex_epsilon, config.simplex_max_ulps, config.simplex_cutoff);
                        this.control = control;
                }

                protected void incrementIterationCount()
                {
                        if (control.cancelled())
                                throw new Interrupted(SolveStatus.CANCELLED);
                        if (control.expired())
                                throw new Interrupted(SolveStatus.TIMED_OUT);
                        super.incrementIterationCount();
                }
        }

        public SimplexBackend(Config config)
        {
                this.config = config;
        }

        String name()
        {
                return "simplex";
        }

        boolean available()
        {
                return true;
        }

        SolveOutcome solve(LinearProgram lp, SolveControl control)
        {
                int n = lp.num_variables();
                LinearObjectiveFunction f = new LinearObjectiveFunction(lp.objective(), 0);
                List<LinearConstraint> constraints = new ArrayList<LinearConstraint>();
                for (LinearProgram.Row row : lp.rows())
                {
                        Relationship rel;
                        switch (row.relation)
                        {
                        case LEQ:
                                rel = Relationship.LEQ;
                                break;
                        case GEQ:
                                rel = Relationship.GEQ;
                                break;
                        default:
                                rel = Relationship.EQ;
                                break;
                        }
                        constraints.add(new LinearConstraint(row.dense(n), rel, row.rhs));
                }
                PivotSelectionRule rule = config.simplex_pivot_rule.equals("bland") ? PivotSelectionRule.BLAND : PivotSelectionRule.DANTZIG;

                ControlledSimplexSolver solver = new ControlledSimplexSolver(config, control);
                try
                {
                        PointValuePair solution = solver.optimize(new MaxIter(config.simplex_max_iterations), f, new LinearConstraintSet(constraints),
                                GoalType.MINIMIZE, new NonNegativeConstraint(true), rule);
                        return SolveOutcome.optimal(name(), solution.getPoint(), solution.getValue());
                }
                catch (NoFeasibleSolutionException e)
                {
                        return SolveOutcome.of(SolveStatus.INFEASIBLE, name(), "no feasible solution");
                }
                catch (UnboundedSolutionException e)
                {
                        return SolveOutcome.of(SolveStatus.UNBOUNDED, name(), "unbounded solution");
                }
                catch (TooManyIterationsException e)
                {
                        return SolveOutcome.of(SolveStatus.SOLVER_UNAVAILABLE, name(), "iteration limit " + config.simplex_max_iterations + " reached");
                }
                catch (Interrupted e)
                {
                        return SolveOutcome.of(e.status, name(), e.status == SolveStatus.CANCELLED ? "cancelled" : "time limit reached");
                }
        }
}
