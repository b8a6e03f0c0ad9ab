/*
Copyright 2013-2024 National Technology & Engineering Solutions of Sandia, LLC (NTESS).
Under the terms of Contract DE-NA0003525 with NTESS,
the U.S. Government retains certain rights in this software.
*/

package gov.sandia.ephys.language;

import java.lang.ref.WeakReference;

/**
    Reference to a named variable. The object it refers to belongs to the caller's model;
    it is handed to the naming function untouched.
**/
public class AccessVariable extends OperatorLHS
{
    public final String                name;
    protected final WeakReference<Object> reference;  // null if this name is not bound to anything

    public AccessVariable (String name)
    {
        this (name, null);
    }

    public AccessVariable (String name, Object variable)
    {
        if (name == null  ||  name.isEmpty ()) throw new IllegalArgumentException ("A variable reference needs a name");
        this.name = name;
        if (variable == null) reference = null;
        else                  reference = new WeakReference<Object> (variable);
    }

    /**
        @return The external variable object, or null if there is none (or it has been collected).
    **/
    public Object getReference ()
    {
        if (reference == null) return null;
        return reference.get ();
    }

    public AccessVariable getVariable ()
    {
        return this;
    }

    public <T> T render (Renderer<T> renderer)
    {
        return renderer.render (this);
    }

    public boolean equals (Object that)
    {
        if (! (that instanceof AccessVariable)) return false;
        AccessVariable a = (AccessVariable) that;
        return name.equals (a.name)  &&  getReference () == a.getReference ();
    }

    public int hashCode ()
    {
        return name.hashCode ();
    }

    public String toString ()
    {
        return name;
    }
}
