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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.json.JSONTokener;

/**
 * Configuration of the coregistration operation. The default document packaged
 * on the classpath is overwritten key by key by the JSON files of the same
 * name found in the configuration directory, then by any documents listed in
 * the "extraconfigs" array.
 * @author aaron.cherney
 */
public class CoregConfig
{
	/**
	 * System property naming the directory searched for configuration files
	 */
	public static final String CONFIG_DIR_PROPERTY = "gridcoreg.config.dir";


	/**
	 * Name of the default configuration document
	 */
	public static final String DEFAULT_NAME = "coregister";


	private static final Logger LOGGER = LogManager.getLogger(CoregConfig.class);


	private final JSONObject m_oConfig;


	/**
	 * Names of the configuration files that failed to load
	 */
	private final ArrayList<String> m_oErrors = new ArrayList<>();


	private CoregConfig(JSONObject oConfig)
	{
		m_oConfig = oConfig;
	}


	/**
	 * Loads the default document and the overrides from the directory named
	 * by the {@value #CONFIG_DIR_PROPERTY} system property, if set.
	 * @return the loaded configuration
	 */
	public static CoregConfig load()
	{
		String sDir = System.getProperty(CONFIG_DIR_PROPERTY);
		return load(sDir == null ? null : Paths.get(sDir), DEFAULT_NAME);
	}


	/**
	 * Loads the default document and overlays the given configuration names
	 * found in the given directory.
	 * @param oConfigDir directory containing &lt;name&gt;.json files, may be null
	 * @param sConfigNames names of the documents to overlay, in order
	 * @return the loaded configuration
	 */
	public static CoregConfig load(Path oConfigDir, String... sConfigNames)
	{
		CoregConfig oConfig = new CoregConfig(new JSONObject());
		oConfig.loadDefaults();
		if (oConfigDir != null)
			oConfig.overlay(oConfigDir, sConfigNames);

		return oConfig;
	}


	/**
	 * Wraps an already parsed document, used when the caller builds the
	 * configuration in code.
	 * @param oConfig configuration values
	 * @return configuration backed by a copy of the document
	 */
	public static CoregConfig of(JSONObject oConfig)
	{
		return new CoregConfig(new JSONObject(oConfig.toString()));
	}


	private void loadDefaults()
	{
		String sResource = String.format("/gridcoreg/%s.json", DEFAULT_NAME);
		try (InputStream oIs = CoregConfig.class.getResourceAsStream(sResource))
		{
			if (oIs == null)
			{
				LOGGER.warn(String.format("Default configuration %s not found, using built in values", sResource));
				return;
			}
			merge(new JSONObject(new JSONTokener(new InputStreamReader(oIs, StandardCharsets.UTF_8))));
		}
		catch (IOException | JSONException oEx)
		{
			LOGGER.error(String.format("Failed to load configuration for %s", sResource), oEx);
			addConfigError(sResource);
		}
	}


	private void overlay(Path oConfigDir, String... sConfigNames)
	{
		for (String sConfig : sConfigNames)
		{
			Path oFile = oConfigDir.resolve(String.format("%s.json", sConfig.replace('.', '_')));
			if (!Files.exists(oFile))
				continue;

			try (BufferedReader oIn = Files.newBufferedReader(oFile, StandardCharsets.UTF_8))
			{
				merge(new JSONObject(new JSONTokener(oIn)));
			}
			catch (IOException | JSONException oEx)
			{
				LOGGER.error(String.format("Failed to load configuration for %s", sConfig), oEx);
				addConfigError(sConfig);
			}
		}

		String[] sExtraConfigs = JSONUtil.getStringArray(m_oConfig, "extraconfigs");
		if (sExtraConfigs.length == 0)
			return;
		m_oConfig.remove("extraconfigs"); // each list is followed once
		for (String sExtra : sExtraConfigs)
		{
			for (String sConfig : sConfigNames)
			{
				if (sExtra.compareTo(sConfig) == 0)
					return;
			}
		}
		overlay(oConfigDir, sExtraConfigs);
	}


	private void merge(JSONObject oOverWrite)
	{
		for (String sKey : oOverWrite.keySet())
			m_oConfig.put(sKey, oOverWrite.get(sKey));
	}


	private void addConfigError(String sConfig)
	{
		synchronized (m_oErrors)
		{
			m_oErrors.add(sConfig);
		}
	}


	/**
	 * @return names of the configuration documents that could not be loaded
	 */
	public List<String> getConfigErrors()
	{
		synchronized (m_oErrors)
		{
			return Collections.unmodifiableList(new ArrayList<>(m_oErrors));
		}
	}


	/**
	 * @return default upsampling method name
	 */
	public String getUpsampleMethod()
	{
		return m_oConfig.optString("upsample", "linear");
	}


	/**
	 * @return default downsampling method name
	 */
	public String getDownsampleMethod()
	{
		return m_oConfig.optString("downsample", "mean");
	}


	/**
	 * Absolute tolerance for the grid comparisons. 0 means exact floating
	 * point comparison.
	 * @return comparison tolerance, never negative
	 */
	public double getTolerance()
	{
		return Math.max(0.0, m_oConfig.optDouble("tolerance", 0.0));
	}


	/**
	 * @return number of threads resampling time slices, at least 1
	 */
	public int getThreads()
	{
		return Math.max(1, m_oConfig.optInt("threads", 1));
	}
}
