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

/**
 * Monitor covering a fixed share of its parent's work. Its own total work is
 * scaled onto that share, and when it is done the parent has received exactly
 * the share. Cancellation is shared with the parent.
 */
public class ChildMonitor extends Monitor
{
	private final Monitor m_oParent;


	/**
	 * Parent work units this child accounts for
	 */
	private final double m_dPartialWork;


	/**
	 * Parent work units forwarded so far
	 */
	private double m_dReported = 0.0;


	public ChildMonitor(Monitor oParent, double dPartialWork)
	{
		m_oParent = oParent;
		m_dPartialWork = dPartialWork;
	}


	@Override
	protected void onStart(String sLabel, double dTotalWork)
	{
		m_dReported = 0.0;
		m_oParent.progress(0.0, sLabel);
	}


	@Override
	protected void onProgress(double dDelta, String sMsg)
	{
		double dTotal = getTotalWork();
		if (dTotal <= 0.0)
			return;

		double dParentWork = Math.min(m_dPartialWork - m_dReported, dDelta * m_dPartialWork / dTotal);
		m_dReported += dParentWork;
		m_oParent.progress(dParentWork, sMsg);
	}


	@Override
	protected void onDone(double dRemaining)
	{
		double dParentWork = m_dPartialWork - m_dReported;
		m_dReported = m_dPartialWork;
		if (dParentWork > 0.0)
			m_oParent.progress(dParentWork, null);
	}


	@Override
	public void cancel()
	{
		m_oParent.cancel();
	}


	@Override
	public boolean isCancelled()
	{
		return m_oParent.isCancelled();
	}
}
