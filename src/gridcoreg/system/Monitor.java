/*
 * Copyright 2017 Synesis-Partners.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package gridcoreg.system;

import gridcoreg.comp.CancelledException;

/**
 * Base class for progress monitors. A monitor is started with a label and a
 * total amount of work, receives increments of work and is marked done once.
 * Monitors form trees through {@link #child(double)}, where a child maps its
 * own total work onto a share of its parent's work.
 * <p>
 * Work never exceeds the declared total and {@link #done()} takes effect at
 * most once per span, so updates from several threads aggregate
 * monotonically. Subclasses render progress by overriding the on* hooks,
 * which are called while holding the monitor's lock.
 * </p>
 * @author aaron.cherney
 */
public abstract class Monitor
{
	/**
	 * Monitor that ignores all progress and is never cancelled
	 */
	public static final Monitor NONE = new NullMonitor();


	/**
	 * Label of the current span
	 */
	private String m_sLabel;


	/**
	 * Total work declared by {@link #start(java.lang.String, double)}
	 */
	private double m_dTotalWork;


	/**
	 * Work reported so far in the current span
	 */
	private double m_dWorked;


	private boolean m_bStarted = false;


	private boolean m_bDone = false;


	private volatile boolean m_bCancelled = false;


	/**
	 * Starts a new span of work.
	 * @param sLabel describes the work
	 * @param dTotalWork total amount of work units the span will report
	 */
	public synchronized void start(String sLabel, double dTotalWork)
	{
		m_sLabel = sLabel;
		m_dTotalWork = dTotalWork;
		m_dWorked = 0.0;
		m_bStarted = true;
		m_bDone = false;
		onStart(sLabel, dTotalWork);
	}


	/**
	 * Reports an amount of completed work. The amount is clipped so the work
	 * of the span never exceeds its total. Ignored once the span is done.
	 * @param dWork completed work units
	 * @param sMsg optional message, may be null
	 */
	public synchronized void progress(double dWork, String sMsg)
	{
		if (m_bDone)
			return;

		double dDelta = Math.max(0.0, dWork);
		if (m_bStarted)
			dDelta = Math.min(dDelta, m_dTotalWork - m_dWorked);
		m_dWorked += dDelta;
		onProgress(dDelta, sMsg);
	}


	/**
	 * Marks the current span as done, reporting any work not reported yet.
	 * Calling it again has no effect until the monitor is started again.
	 */
	public synchronized void done()
	{
		if (m_bDone)
			return;

		m_bDone = true;
		double dRemaining = m_bStarted ? Math.max(0.0, m_dTotalWork - m_dWorked) : 0.0;
		m_dWorked += dRemaining;
		onDone(dRemaining);
	}


	/**
	 * Requests cancellation of the work observed by this monitor.
	 */
	public void cancel()
	{
		m_bCancelled = true;
	}


	public boolean isCancelled()
	{
		return m_bCancelled;
	}


	/**
	 * @throws CancelledException if cancellation has been requested
	 */
	public void checkForCancellation()
	{
		if (isCancelled())
			throw new CancelledException(getLabel());
	}


	public synchronized String getLabel()
	{
		return m_sLabel;
	}


	public synchronized double getTotalWork()
	{
		return m_dTotalWork;
	}


	public synchronized double getWorked()
	{
		return m_dWorked;
	}


	public synchronized boolean isDone()
	{
		return m_bDone;
	}


	/**
	 * Creates a child monitor that accounts for the given amount of this
	 * monitor's work.
	 * @param dWork work units of this monitor covered by the child
	 * @return the new child
	 */
	public Monitor child(double dWork)
	{
		return new ChildMonitor(this, dWork);
	}


	/**
	 * Starts a span and returns a scope that marks it done when closed.
	 * @param sLabel describes the work
	 * @param dTotalWork total amount of work units
	 * @return scope to use in a try-with-resources statement
	 */
	public Scope starting(String sLabel, double dTotalWork)
	{
		start(sLabel, dTotalWork);
		return new Scope(this);
	}


	/**
	 * Starts a span of exactly one unit of work that is reported when the
	 * returned scope is closed.
	 * @param sLabel describes the work
	 * @return scope to use in a try-with-resources statement
	 */
	public Scope observing(String sLabel)
	{
		return starting(sLabel, 1.0);
	}


	protected void onStart(String sLabel, double dTotalWork)
	{
	}


	protected void onProgress(double dDelta, String sMsg)
	{
	}


	protected void onDone(double dRemaining)
	{
	}


	/**
	 * Marks the span of its monitor done when closed, on normal and
	 * exceptional exits alike.
	 */
	public static final class Scope implements AutoCloseable
	{
		private final Monitor m_oMonitor;


		private Scope(Monitor oMonitor)
		{
			m_oMonitor = oMonitor;
		}


		public Monitor getMonitor()
		{
			return m_oMonitor;
		}


		@Override
		public void close()
		{
			m_oMonitor.done();
		}
	}


	/**
	 * Ignores everything. Shared, so it keeps no state.
	 */
	private static final class NullMonitor extends Monitor
	{
		@Override
		public void start(String sLabel, double dTotalWork)
		{
		}


		@Override
		public void progress(double dWork, String sMsg)
		{
		}


		@Override
		public void done()
		{
		}


		@Override
		public void cancel()
		{
		}


		@Override
		public boolean isCancelled()
		{
			return false;
		}
	}
}
