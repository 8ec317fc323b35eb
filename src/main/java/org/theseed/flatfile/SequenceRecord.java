/**
 *
 */
package org.theseed.flatfile;

/**
 * This interface describes a parsed sequence record of any input format.
 *
 * @author Bruce Parrello
 *
 */
public interface SequenceRecord {

    /**
     * @return the identifier of this record
     */
    public String getId();

    /**
     * @return the sequence of this record, without whitespace
     */
    public String getSequence();

}
