package org.jpp.util;

import java.nio.file.Path;
import java.util.Locale;

public class FileUtils
{
	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	public static String getBaseName(Path path)
	{
		return path.getFileName().toString().replaceFirst("[.][^.]+$", "");
	}

	/**
	 * Name of the generated public class: first letter upper case, the rest lower case.
	 */
	public static String toUnitName(Path sourceFile)
	{
		String base = getBaseName(sourceFile);
		if (base.isEmpty())
		{
			return "Main";
		}
		return base.substring(0, 1).toUpperCase(Locale.ROOT) + base.substring(1).toLowerCase(Locale.ROOT);
	}
}
