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

/**
 * Time limit and cancellation for one solve.
 *
 * The clock starts on the first call to start(). cancel() may be called from
 * any thread; it sets a flag backends poll and forwards to the interrupter of
 * the running backend, if it registered one.
 */
public class SolveControl
{
        private final double timeout; // Seconds.
        private long deadline = Long.MAX_VALUE; // System.nanoTime() value.
        private boolean started = false;
        private volatile boolean cancelled = false;
        private volatile Runnable interrupter = null;

        public SolveControl(double timeout)
        {
                assert(timeout >= 0);
                this.timeout = timeout;
        }

        public synchronized void start()
        {
                if (started)
                        return;
                started = true;
                if (!Double.isInfinite(timeout))
                        deadline = System.nanoTime() + (long) Math.min(timeout * 1e9, Long.MAX_VALUE / 2);
        }

        public boolean expired()
        {
                long d;
                synchronized (this)
                {
                        if (!started)
                                return false;
                        d = deadline;
                }
                return d != Long.MAX_VALUE && System.nanoTime() - d >= 0;
        }

        /**
         * Milliseconds left before the deadline, or Long.MAX_VALUE when unlimited.
         */
        public synchronized long remaining_millis()
        {
                if (deadline == Long.MAX_VALUE)
                        return Long.MAX_VALUE;
                return Math.max(0, (deadline - System.nanoTime()) / 1000000);
        }

        public void cancel()
        {
                cancelled = true;
                Runnable r = interrupter;
                if (r != null)
                        r.run();
        }

        public boolean cancelled()
        {
                return cancelled;
        }

        public void set_interrupter(Runnable interrupter)
        {
                this.interrupter = interrupter;
                if (interrupter != null && cancelled)
                        interrupter.run();
        }
}
