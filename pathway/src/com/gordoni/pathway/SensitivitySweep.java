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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Solves the same planning data under several configurations in parallel.
 *
 * Every variant gets its own planner, and every planner its own copy of the
 * configuration, so runs share nothing but the read only planning data.
 * Results are returned in the order of the variants.
 */
public class SensitivitySweep
{
        private final DecimalFormat f3f = new DecimalFormat("0.000");

        private final Config config;
        private final PlanningData data;

        public SensitivitySweep(Config config, PlanningData data)
        {
                this.config = config.clone();
                this.data = data;
        }

        /**
         * Copy of config with the named parameters overridden.
         */
        public static Config variant(Config config, Map<String, Object> params)
        {
                Config res = config.clone();
                res.applyParams(params);
                return res;
        }

        public static List<Config> discount_rates(Config config, double... rates)
        {
                List<Config> res = new ArrayList<Config>();
                for (double rate : rates)
                {
                        Map<String, Object> params = new HashMap<String, Object>();
                        params.put("discount_rate", rate);
                        res.add(variant(config, params));
                }
                return res;
        }

        public List<PathwayResult> run(List<Config> variants) throws ExecutionException, InterruptedException
        {
                long start = System.currentTimeMillis();

                List<Callable<PathwayResult>> tasks = new ArrayList<Callable<PathwayResult>>();
                for (final Config variant : variants)
                {
                        tasks.add(new Callable<PathwayResult>()
                        {
                                public PathwayResult call()
                                {
                                        return new PathwayPlanner(variant, data).solve();
                                }
                        });
                }

                List<PathwayResult> res = new ArrayList<PathwayResult>();
                ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, Math.min(config.workers, tasks.size())));
                try
                {
                        List<Future<PathwayResult>> future_tasks = executor.invokeAll(tasks);
                        for (Future<PathwayResult> f : future_tasks)
                                res.add(f.get());
                }
                catch (ExecutionException | InterruptedException | RuntimeException e)
                {
                        executor.shutdownNow();
                        throw e;
                }
                executor.shutdown();

                if (config.trace)
                {
                        double elapsed = (System.currentTimeMillis() - start) / 1000.0;
                        System.out.println("Sweep of " + variants.size() + " variants done: " + f3f.format(elapsed) + " seconds");
                }

                return res;
        }
}
