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

import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ResampleMethodsTest
{
	@Test
	void knownNamesMapToKernelCodes()
	{
		assertEquals(10, ResampleMethods.getUpsampleCode("nearest"));
		assertEquals(11, ResampleMethods.getUpsampleCode("linear"));
		assertEquals(50, ResampleMethods.getDownsampleCode("first"));
		assertEquals(51, ResampleMethods.getDownsampleCode("last"));
		assertEquals(54, ResampleMethods.getDownsampleCode("mean"));
		assertEquals(56, ResampleMethods.getDownsampleCode("mode"));
		assertEquals(57, ResampleMethods.getDownsampleCode("var"));
		assertEquals(58, ResampleMethods.getDownsampleCode("std"));
	}


	@Test
	void unknownNamesAreRejected()
	{
		IllegalArgumentException oEx = assertThrows(IllegalArgumentException.class, () -> ResampleMethods.getUpsampleCode("cubic"));
		assertTrue(oEx.getMessage().contains("cubic"));
		assertThrows(IllegalArgumentException.class, () -> ResampleMethods.getDownsampleCode("median"));
		assertThrows(IllegalArgumentException.class, () -> ResampleMethods.getDownsampleCode("nearest"));
		assertThrows(IllegalArgumentException.class, () -> ResampleMethods.getUpsampleCode(null));
	}


	@Test
	void codeFamiliesDoNotOverlap()
	{
		for (String sName : ResampleMethods.getUpsampleNames())
		{
			int nCode = ResampleMethods.getUpsampleCode(sName);
			assertTrue(ResampleMethods.isUpsampleCode(nCode));
			assertFalse(ResampleMethods.isDownsampleCode(nCode));
		}
		for (String sName : ResampleMethods.getDownsampleNames())
		{
			int nCode = ResampleMethods.getDownsampleCode(sName);
			assertTrue(ResampleMethods.isDownsampleCode(nCode));
			assertFalse(ResampleMethods.isUpsampleCode(nCode));
		}
	}


	@Test
	void nameListsCannotRemapCodes()
	{
		List<String> oNames = ResampleMethods.getDownsampleNames();
		assertEquals(Arrays.asList("first", "last", "mean", "mode", "var", "std"), oNames);
		assertThrows(UnsupportedOperationException.class, () -> oNames.set(0, "mean"));
		assertThrows(UnsupportedOperationException.class, () -> ResampleMethods.getUpsampleNames().set(0, "linear"));

		assertEquals(50, ResampleMethods.getDownsampleCode("first"));
		assertEquals(10, ResampleMethods.getUpsampleCode("nearest"));
		assertEquals(Arrays.asList("nearest", "linear"), ResampleMethods.getUpsampleNames());
	}
}
