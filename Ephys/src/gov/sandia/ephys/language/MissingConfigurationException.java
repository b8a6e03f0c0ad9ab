/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

/**
    Thrown when a renderer is built without a setting its target language cannot do without.
**/
@SuppressWarnings("serial")
public class MissingConfigurationException extends RuntimeException
{
    public final String field;

    public MissingConfigurationException (String field, String target)
    {
        super (target + " requires " + field);
        this.field = field;
    }
}
