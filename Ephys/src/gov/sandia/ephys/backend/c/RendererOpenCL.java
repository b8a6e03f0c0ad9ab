/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import java.util.HashSet;
import java.util.Set;

/**
    Renders expressions as OpenCL C. Built-in functions are overloaded on argument type,
    so precision only changes literals. Native math selects the native_ versions where they exist.
**/
public class RendererOpenCL extends RendererGPU
{
    protected static final Set<String> natives = new HashSet<String> ();
    static
    {
        natives.add ("sqrt");
        natives.add ("sin");
        natives.add ("cos");
        natives.add ("tan");
        natives.add ("exp");
        natives.add ("log");
        natives.add ("log10");
    }

    /**
        Single precision with the standard built-ins. The native_ functions have
        implementation-defined accuracy, so they are only used when asked for.
    **/
    public RendererOpenCL ()
    {
        this (Precision.SINGLE, false);
    }

    public RendererOpenCL (Precision precision, boolean nativeMath)
    {
        super (precision, nativeMath);
    }

    public String math (String name)
    {
        if (nativeMath  &&  natives.contains (name)) return "native_" + name;
        return name;
    }
}
