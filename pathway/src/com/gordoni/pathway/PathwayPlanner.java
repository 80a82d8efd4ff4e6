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

import java.text.DecimalFormat;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Plans the least cost deployment pathway for one set of planning data.
 *
 * Construction validates and resolves the data, assembles the linear program
 * and leaves the planner BUILT. solve() may be called once. cancel() may be
 * called from another thread while solve() runs.
 */
public class PathwayPlanner
{
        private final DecimalFormat f3f = new DecimalFormat("0.000");

        private final Config config;
        private final ModelInputs in;
        private final VintageIndex vintages;
        private final LinearProgram lp;
        private final VariableLayout vars;
        private final ObjectiveBuilder objective;

        private RunState state;
        private volatile SolveControl control = null;
        private volatile boolean cancel_requested = false;

        public PathwayPlanner(Config config, PlanningData data)
        {
                this.config = config.clone();
                if (this.config.trace)
                {
                        System.out.println("Parameters:");
                        this.config.dumpParams();
                }

                long start = System.currentTimeMillis();

                in = new ModelInputs(this.config, data);
                vintages = new VintageIndex(in);
                lp = new LinearProgram();
                vars = new VariableLayout(in, lp, this.config.slack);
                new ConstraintAssembler(in, vintages, vars, lp).assemble();
                objective = new ObjectiveBuilder(in, vintages, vars, lp);
                objective.build();

                if (this.config.trace)
                {
                        double elapsed = (System.currentTimeMillis() - start) / 1000.0;
                        System.out.println("Model built: " + lp.num_variables() + " variables, " + lp.rows().size() + " rows in " + f3f.format(elapsed) + " seconds");
                        for (Map.Entry<String, Integer> e : lp.family_counts().entrySet())
                                System.out.println("   " + e.getKey() + " " + e.getValue());
                }

                state = RunState.BUILT;
        }

        public PathwayResult solve()
        {
                return solve(new SolveControl(config.solver_timeout));
        }

        public PathwayResult solve(SolveControl control)
        {
                synchronized (this)
                {
                        if (state != RunState.BUILT)
                                throw new IllegalStateException("Planner already " + state);
                        state = RunState.SOLVING;
                }
                this.control = control;
                if (cancel_requested)
                        control.cancel();

                SolveOutcome outcome;
                try
                {
                        outcome = new SolverAdapter(config).solve(lp, control);
                }
                catch (RuntimeException | Error e)
                {
                        set_state(RunState.SOLVER_UNAVAILABLE);
                        throw e;
                }

                set_state(RunState.of(outcome.status));
                if (config.trace)
                        System.out.println("Solve: " + outcome);

                switch (outcome.status)
                {
                case OPTIMAL:
                        return new ResultExtractor(in, vintages, vars, objective).extract(outcome);
                case UNBOUNDED:
                        throw new ModelIntegrityException("Model is unbounded" + (outcome.message == null ? "" : ": " + outcome.message));
                case INFEASIBLE:
                        List<Integer> short_years = new AbatementPotential(in, vintages).short_years();
                        if (config.trace && !short_years.isEmpty())
                                System.out.println("Abatement potential falls short of the requirement in " + short_years);
                        return PathwayResult.unsolved(outcome, objective.penalty(), short_years);
                default:
                        return PathwayResult.unsolved(outcome, objective.penalty(), Collections.<Integer>emptyList());
                }
        }

        private synchronized void set_state(RunState state)
        {
                this.state = state;
        }

        public synchronized RunState state()
        {
                return state;
        }

        /**
         * Request that a pending or running solve stop. The result is CANCELLED unless the solve has already finished.
         */
        public void cancel()
        {
                cancel_requested = true;
                SolveControl c = control;
                if (c != null)
                        c.cancel();
        }

        public Config config()
        {
                return config;
        }

        public ModelInputs inputs()
        {
                return in;
        }

        public VintageIndex vintages()
        {
                return vintages;
        }

        public LinearProgram program()
        {
                return lp;
        }

        public VariableLayout variables()
        {
                return vars;
        }

        public ObjectiveBuilder objective()
        {
                return objective;
        }
}
