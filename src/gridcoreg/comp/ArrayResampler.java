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

import gridcoreg.store.GridAxis;
import gridcoreg.store.RasterVariable;
import gridcoreg.system.Monitor;
import java.util.ArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Resamples every time slice of a (time, lat, lon) variable onto a new lat/lon
 * grid and reassembles the slices in time order.
 * @author aaron.cherney
 */
public abstract class ArrayResampler
{
	/**
	 * Label of the progress span of one variable
	 */
	public static final String LABEL = "coregister dataarray";


	private static final Logger LOGGER = LogManager.getLogger(ArrayResampler.class);


	private ArrayResampler()
	{
	}


	/**
	 * Resamples the given variable on the calling thread.
	 * @see #resampleArray(gridcoreg.store.RasterVariable, gridcoreg.store.GridAxis, gridcoreg.store.GridAxis, int, int, gridcoreg.system.Monitor, java.util.concurrent.ExecutorService)
	 */
	public static RasterVariable resampleArray(RasterVariable oVar, GridAxis oLon, GridAxis oLat, int nUsMethod, int nDsMethod, Monitor oParent)
	{
		return resampleArray(oVar, oLon, oLat, nUsMethod, nDsMethod, oParent, null);
	}


	/**
	 * Resamples the given variable to the grid defined by the given lat and lon
	 * axes. The result keeps the name, dimension order and attributes of the
	 * variable and is chunked by time step. One unit of the parent monitor's
	 * work is consumed, split evenly between the time slices. Cancellation is
	 * checked before each slice.
	 * @param oVar variable with time, lat and lon dimensions
	 * @param oLon longitudes of the new grid
	 * @param oLat latitudes of the new grid
	 * @param nUsMethod upsampling code, see {@link ResampleMethods}
	 * @param nDsMethod downsampling code, see {@link ResampleMethods}
	 * @param oParent parent progress monitor
	 * @param oExecutor runs the slices concurrently if not null, otherwise the
	 * slices are resampled in order on the calling thread
	 * @return the resampled variable
	 * @throws CancelledException if cancellation was requested
	 */
	public static RasterVariable resampleArray(RasterVariable oVar, GridAxis oLon, GridAxis oLat, int nUsMethod, int nDsMethod, Monitor oParent, ExecutorService oExecutor)
	{
		int nWidth = oLon.size();
		int nHeight = oLat.size();
		int nSrcW = oVar.getDimSize(GridAxis.LON);
		int nSrcH = oVar.getDimSize(GridAxis.LAT);
		int nTimes = oVar.getDimSize(GridAxis.TIME);

		Monitor oMonitor = oParent.child(1);
		double[][] dSlices = new double[nTimes][];
		try (Monitor.Scope oScope = oMonitor.starting(LABEL, nTimes))
		{
			LOGGER.debug(String.format("Resampling %s from %dx%d to %dx%d, %d time steps", oVar.getName(), nSrcW, nSrcH, nWidth, nHeight, nTimes));
			if (oExecutor == null)
			{
				for (int nT = 0; nT < nTimes; nT++)
				{
					oMonitor.checkForCancellation();
					dSlices[nT] = SliceResampler.resampleSlice(oVar.getSlice(nT), nSrcW, nSrcH, nWidth, nHeight, nDsMethod, nUsMethod, oMonitor);
				}
			}
			else
			{
				resampleConcurrently(oVar, dSlices, nSrcW, nSrcH, nWidth, nHeight, nUsMethod, nDsMethod, oMonitor, oExecutor);
			}
		}
		return RasterVariable.fromSlices(oVar.getName(), oVar.getDims(), dSlices, nHeight, nWidth, oVar.getAttrs());
	}


	private static void resampleConcurrently(RasterVariable oVar, double[][] dSlices, int nSrcW, int nSrcH, int nWidth, int nHeight,
		int nUsMethod, int nDsMethod, Monitor oMonitor, ExecutorService oExecutor)
	{
		ArrayList<Future<double[]>> oFutures = new ArrayList<>(dSlices.length);
		try
		{
			for (int nT = 0; nT < dSlices.length; nT++)
			{
				oMonitor.checkForCancellation();
				final int nTime = nT;
				oFutures.add(oExecutor.submit(() ->
				{
					oMonitor.checkForCancellation();
					return SliceResampler.resampleSlice(oVar.getSlice(nTime), nSrcW, nSrcH, nWidth, nHeight, nDsMethod, nUsMethod, oMonitor);
				}));
			}

			for (int nT = 0; nT < dSlices.length; nT++) // collect in time order
				dSlices[nT] = oFutures.get(nT).get();
		}
		catch (ExecutionException oEx)
		{
			cancelAll(oFutures);
			Throwable oCause = oEx.getCause();
			if (oCause instanceof RuntimeException)
				throw (RuntimeException)oCause;
			if (oCause instanceof Error)
				throw (Error)oCause;
			throw new CoregistrationException(String.format("Failed to resample %s", oVar.getName()), oCause);
		}
		catch (InterruptedException oEx)
		{
			cancelAll(oFutures);
			Thread.currentThread().interrupt();
			throw new CancelledException(LABEL);
		}
		catch (RuntimeException oEx)
		{
			cancelAll(oFutures);
			throw oEx;
		}
	}


	private static void cancelAll(ArrayList<Future<double[]>> oFutures)
	{
		for (Future<double[]> oFuture : oFutures)
			oFuture.cancel(true);
	}
}
