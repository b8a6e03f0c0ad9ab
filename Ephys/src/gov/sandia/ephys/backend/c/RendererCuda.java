/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.backend.c;

import java.util.HashMap;
import java.util.Map;

/**
    Renders expressions as CUDA C. In single precision every math function takes its "f" form.
    With native math also enabled, the functions that have a fast hardware intrinsic use it instead.
**/
public class RendererCuda extends RendererGPU
{
    protected static final Map<String,String> intrinsics = new HashMap<String,String> ();
    static
    {
        intrinsics.put ("sin",   "__sinf");
        intrinsics.put ("cos",   "__cosf");
        intrinsics.put ("tan",   "__tanf");
        intrinsics.put ("exp",   "__expf");
        intrinsics.put ("log",   "__logf");
        intrinsics.put ("log10", "__log10f");
        intrinsics.put ("pow",   "__powf");
    }

    public RendererCuda ()
    {
        this (Precision.SINGLE, false);
    }

    public RendererCuda (Precision precision, boolean nativeMath)
    {
        super (precision, nativeMath);
    }

    public String math (String name)
    {
        if (! single ()) return name;
        if (nativeMath)
        {
            String intrinsic = intrinsics.get (name);
            if (intrinsic != null) return intrinsic;
        }
        return name + "f";
    }
}
