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
import java.util.ArrayList;
import java.util.List;

/**
 * Tries linear programming backends in order of preference.
 *
 * A backend that is unknown, can not be loaded, or fails without a conclusion
 * is skipped. The first definitive outcome (optimal, infeasible, unbounded),
 * or a time out or cancellation, is returned. When every backend is skipped
 * the outcome is SOLVER_UNAVAILABLE, with the reasons joined in the message.
 */
public class SolverAdapter
{
        private final DecimalFormat f3f = new DecimalFormat("0.000"); // Per instance; DecimalFormat is not thread safe.

        private final Config config;
        private final List<String> names;
        private final List<LpBackend> backends;

        public SolverAdapter(Config config)
        {
                this.config = config;
                this.names = new ArrayList<String>(config.solvers);
                this.backends = new ArrayList<LpBackend>();
                for (String name : names)
                        backends.add(LpBackend.factory(name, config));
        }

        SolverAdapter(Config config, List<LpBackend> backends)
        {
                this.config = config;
                this.names = new ArrayList<String>();
                for (LpBackend backend : backends)
                        names.add(backend.name());
                this.backends = new ArrayList<LpBackend>(backends);
        }

        public SolveOutcome solve(LinearProgram lp, SolveControl control)
        {
                control.start();
                List<String> reasons = new ArrayList<String>();
                for (int k = 0; k < backends.size(); k++)
                {
                        if (control.cancelled())
                                return SolveOutcome.of(SolveStatus.CANCELLED, null, "cancelled before " + names.get(k));
                        if (control.expired())
                                return SolveOutcome.of(SolveStatus.TIMED_OUT, null, "time limit reached before " + names.get(k));

                        LpBackend backend = backends.get(k);
                        if (backend == null)
                        {
                                reasons.add(names.get(k) + ": unknown solver");
                                continue;
                        }
                        if (!backend.available())
                        {
                                reasons.add(names.get(k) + ": not available");
                                continue;
                        }

                        long start = System.currentTimeMillis();
                        SolveOutcome outcome = backend.solve(lp, control);
                        if (config.trace)
                        {
                                double elapsed = (System.currentTimeMillis() - start) / 1000.0;
                                System.out.println(backend.name() + ": " + outcome + " in " + f3f.format(elapsed) + " seconds");
                        }
                        if (outcome.status != SolveStatus.SOLVER_UNAVAILABLE)
                                return outcome;
                        reasons.add(outcome.solver + ": " + outcome.message);
                }

                StringBuilder sb = new StringBuilder();
                for (String reason : reasons)
                        sb.append(sb.length() == 0 ? "" : "; ").append(reason);
                return SolveOutcome.of(SolveStatus.SOLVER_UNAVAILABLE, null, reasons.isEmpty() ? "no solvers" : sb.toString());
        }
}
