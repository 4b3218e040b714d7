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

import org.apache.logging.log4j.Logger;

/**
 * Root monitor that writes progress to a log4j Logger. A line is logged each
 * time another tenth of the total work completes.
 */
public class LogMonitor extends Monitor
{
	private final Logger m_oLogger;


	/**
	 * Last logged tenth of the total work
	 */
	private int m_nLastStep;


	public LogMonitor(Logger oLogger)
	{
		m_oLogger = oLogger;
	}


	@Override
	protected void onStart(String sLabel, double dTotalWork)
	{
		m_nLastStep = 0;
		m_oLogger.info(String.format("%s: started", sLabel));
	}


	@Override
	protected void onProgress(double dDelta, String sMsg)
	{
		if (sMsg != null)
			m_oLogger.debug(String.format("%s: %s", getLabel(), sMsg));

		double dTotal = getTotalWork();
		if (dTotal <= 0.0)
			return;

		int nStep = (int)(getWorked() * 10.0 / dTotal);
		if (nStep > m_nLastStep && nStep < 10)
		{
			m_nLastStep = nStep;
			m_oLogger.info(String.format("%s: %d%%", getLabel(), nStep * 10));
		}
	}


	@Override
	protected void onDone(double dRemaining)
	{
		m_oLogger.info(String.format("%s: done", getLabel()));
	}
}
