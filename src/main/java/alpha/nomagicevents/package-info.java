/**
 * Home of the library's {@link alpha.nomagicevents.Config Config}.<p>
 * 
 * The registry itself lives in package {@link alpha.nomagicevents.registry}.
 */
package alpha.nomagicevents;
