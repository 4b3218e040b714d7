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
package gridcoreg.comp;

import gridcoreg.store.Dataset;
import gridcoreg.store.GridAxis;
import gridcoreg.store.RasterVariable;
import gridcoreg.system.CoregConfig;
import gridcoreg.system.Monitor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Coregisters two datasets defined on pixel-registered grids that are
 * equidistant in lat/lon coordinates by resampling the slave dataset onto the
 * grid of the master. Upsampling is done by interpolation, downsampling by
 * aggregating the pixels of the slave into the coarser grid. Which of the two
 * is done is determined per axis from the relationship of the grids.
 * <p>
 * The returned dataset covers the lat/lon intersection of the master and
 * slave grids on the master's grid. Every slave variable must have (time, lat,
 * lon) dimensions. Dataset attributes are not carried over, the spatial
 * attributes are recomputed for the new grid.
 * </p>
 * @author aaron.cherney
 */
public class DatasetCoregistrator
{
	/**
	 * Label of the dataset level progress span
	 */
	public static final String LABEL = "coregister dataset";


	public static final double[] LAT_BOUNDS = new double[]{-90.0, 90.0};
	public static final double[] LON_BOUNDS = new double[]{-180.0, 180.0};


	private static final Logger LOGGER = LogManager.getLogger(DatasetCoregistrator.class);


	private static final AtomicInteger POOL_COUNT = new AtomicInteger();


	/**
	 * Tolerance of the grid comparisons, 0 for exact
	 */
	private final double m_dTolerance;


	/**
	 * Number of threads resampling time slices, 1 for the calling thread only
	 */
	private final int m_nThreads;


	/**
	 * Constructs a coregistrator using exact grid comparisons on the calling
	 * thread.
	 */
	public DatasetCoregistrator()
	{
		this(0.0, 1);
	}


	public DatasetCoregistrator(CoregConfig oConfig)
	{
		this(oConfig.getTolerance(), oConfig.getThreads());
	}


	public DatasetCoregistrator(double dTolerance, int nThreads)
	{
		m_dTolerance = Math.max(0.0, dTolerance);
		m_nThreads = Math.max(1, nThreads);
	}


	/**
	 * Resamples the slave dataset onto the grid of the master.
	 * @param oMaster dataset whose lat/lon coordinates define the new grid
	 * @param oSlave dataset to resample
	 * @param sUsMethod upsampling method, nearest or linear
	 * @param sDsMethod downsampling method, first, last, mean, mode, var or std
	 * @param oMonitor progress monitor, {@link Monitor#NONE} to ignore progress
	 * @return the slave dataset resampled onto the master grid
	 * @throws IllegalArgumentException for unknown method names
	 * @throws InvalidGridException if an axis of either dataset is not valid
	 * @throws InvalidVariableShapeException if a slave variable is not (time, lat, lon)
	 * @throws NoIntersectionException if the grids do not intersect
	 * @throws CancelledException if cancellation was requested
	 */
	public Dataset coregister(Dataset oMaster, Dataset oSlave, String sUsMethod, String sDsMethod, Monitor oMonitor)
	{
		int nUsMethod = ResampleMethods.getUpsampleCode(sUsMethod);
		int nDsMethod = ResampleMethods.getDownsampleCode(sDsMethod);
		LOGGER.info(String.format("Coregistering %s onto %s, upsampling %s, downsampling %s", oSlave.getName(), oMaster.getName(), sUsMethod, sDsMethod));

		try
		{
			GridValidator.validate(oMaster, oSlave, m_dTolerance);
		}
		catch (CoregistrationException oEx)
		{
			LOGGER.error(oEx.getMessage());
			throw oEx;
		}

		Dataset oResult = resampleDataset(oMaster, oSlave, nUsMethod, nDsMethod, oMonitor);
		LOGGER.info(String.format("Coregistered %s to %d x %d", oSlave.getName(), oResult.getLat().size(), oResult.getLon().size()));
		return oResult;
	}


	/**
	 * Resamples all variables of the slave dataset onto the master grid. Both
	 * datasets must already be validated.
	 */
	private Dataset resampleDataset(Dataset oMaster, Dataset oSlave, int nUsMethod, int nDsMethod, Monitor oMonitor)
	{
		double[] dLatBounds;
		double[] dLonBounds;
		try
		{
			dLatBounds = IntersectionFinder.findIntersection(GridAxis.LAT, oMaster.getLat().getValues(), oSlave.getLat().getValues(),
				LAT_BOUNDS[0], LAT_BOUNDS[1], m_dTolerance);
			dLonBounds = IntersectionFinder.findIntersection(GridAxis.LON, oMaster.getLon().getValues(), oSlave.getLon().getValues(),
				LON_BOUNDS[0], LON_BOUNDS[1], m_dTolerance);
		}
		catch (NoIntersectionException oEx)
		{
			LOGGER.error(oEx.getMessage());
			throw oEx;
		}

		// plain range selection, a general subset could wrap around the antimeridian
		GridAxis oLat = oMaster.getLat().subset(dLatBounds[IntersectionFinder.MIN], dLatBounds[IntersectionFinder.MAX]);
		GridAxis oLon = oMaster.getLon().subset(dLonBounds[IntersectionFinder.MIN], dLonBounds[IntersectionFinder.MAX]);
		if (oLat.size() == 0 || oLon.size() == 0)
		{
			GridAxis oEmpty = oLat.size() == 0 ? oLat : oLon;
			double[] dBounds = oLat.size() == 0 ? dLatBounds : dLonBounds;
			GridAxis oMasterAxis = oLat.size() == 0 ? oMaster.getLat() : oMaster.getLon();
			GridAxis oSlaveAxis = oLat.size() == 0 ? oSlave.getLat() : oSlave.getLon();
			NoIntersectionException oEx = new NoIntersectionException("no master pixel center inside the intersection", oEmpty.getName(),
				dBounds[IntersectionFinder.MIN], dBounds[IntersectionFinder.MAX], oMasterAxis.getPixelSize(), oSlaveAxis.getPixelSize());
			LOGGER.error(oEx.getMessage());
			throw oEx;
		}
		LOGGER.debug(String.format("Target grid %s %s", oLat, oLon));

		Map<String, RasterVariable> oSlaveVars = oSlave.getVariables();
		LinkedHashMap<String, RasterVariable> oResampled = new LinkedHashMap<>();
		ExecutorService oExecutor = m_nThreads > 1 ? createThreadPool(m_nThreads) : null;
		try (Monitor.Scope oScope = oMonitor.starting(LABEL, oSlaveVars.size()))
		{
			for (RasterVariable oVar : oSlaveVars.values())
			{
				oMonitor.checkForCancellation();
				LOGGER.debug(String.format("Resampling variable %s", oVar.getName()));
				oResampled.put(oVar.getName(), ArrayResampler.resampleArray(oVar, oLon, oLat, nUsMethod, nDsMethod, oMonitor, oExecutor));
			}
		}
		finally
		{
			if (oExecutor != null)
				oExecutor.shutdownNow();
		}

		Dataset oResult = new Dataset(oSlave.getName(), oLat, oLon, oSlave.getTime());
		for (RasterVariable oVar : oResampled.values())
			oResult.addVariable(oVar);

		return SpatialAttrs.adjust(oResult);
	}


	private static ExecutorService createThreadPool(int nThreads)
	{
		return Executors.newFixedThreadPool(nThreads, new NameableThreadFactory(String.format("coregister-%d", POOL_COUNT.incrementAndGet())));
	}


	private static class NameableThreadFactory implements ThreadFactory
	{
		private final String m_sName;
		private final AtomicInteger m_nCount = new AtomicInteger();


		NameableThreadFactory(String sName)
		{
			m_sName = sName;
		}


		@Override
		public Thread newThread(Runnable oRunnable)
		{
			Thread oThread = new Thread(oRunnable, String.format("%s-%d", m_sName, m_nCount.incrementAndGet()));
			oThread.setDaemon(true);
			return oThread;
		}
	}
}
