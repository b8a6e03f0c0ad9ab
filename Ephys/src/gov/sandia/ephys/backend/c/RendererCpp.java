/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

/**
    Renders expressions as C++. The expression syntax is the same as C, using the C math library
    names, which C++ inherits through cmath.
**/
public class RendererCpp extends RendererC
{
    public RendererCpp ()
    {
    }

    public RendererCpp (Precision precision)
    {
        super (precision);
    }
}
